package com.jobscout.discovery.browser;

import java.util.List;

/**
 * Live element on the session's current page. Becomes stale once the page navigates away.
 */
public interface PageElement {
    String text();

    String attribute(String name);

    List<PageElement> findAll(String selector);

    void scrollIntoView();

    void hover();
}
