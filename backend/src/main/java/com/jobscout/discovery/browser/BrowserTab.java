package com.jobscout.discovery.browser;

import java.time.Duration;

/**
 * A tab opened as a side effect of a click. The opener is responsible for closing it.
 */
public interface BrowserTab extends AutoCloseable {
    /**
     * @return false when the tab did not reach a loaded state within {@code timeout}
     */
    boolean awaitLoad(Duration timeout);

    String url();

    @Override
    void close();
}
