package com.jobscout.discovery.browser;

import com.jobscout.discovery.model.PageSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One browser context with a primary tab, owned by a single worker thread. Driver failures and
 * timeouts surface as {@link BrowserOperationException}.
 */
public interface BrowserSession extends AutoCloseable {
    void navigate(String url);

    String currentUrl();

    String title();

    String content();

    String bodyText();

    boolean hasElement(String selector);

    Optional<PageElement> querySelector(String selector);

    /**
     * Clicks {@code target} and waits up to {@code timeout} for either a new tab or a navigation
     * of the primary tab. A click that produces neither returns {@link ClickOutcome#none()}.
     */
    ClickOutcome clickAndAwait(PageElement target, Duration timeout);

    int openTabCount();

    /**
     * Closes every tab except the primary one.
     *
     * @return number of tabs closed
     */
    int closeExtraTabs();

    List<BrowserCookie> cookies();

    void addCookies(List<BrowserCookie> cookies);

    default PageSnapshot snapshot() {
        return new PageSnapshot(currentUrl(), content());
    }

    @Override
    void close();
}
