package com.jobscout.discovery.browser;

public interface BrowserSessionFactory {
    /**
     * Opens a session for a worker. Must be called from the thread that will use it.
     */
    BrowserSession open();

    /**
     * Opens a headed session an operator can interact with.
     */
    BrowserSession openVisible();
}
