package com.jobscout.discovery.browser;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

class PlaywrightBrowserTab implements BrowserTab {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserTab.class);

    private final Page page;

    PlaywrightBrowserTab(Page page) {
        this.page = page;
    }

    @Override
    public boolean awaitLoad(Duration timeout) {
        try {
            page.waitForLoadState(
                LoadState.DOMCONTENTLOADED,
                new Page.WaitForLoadStateOptions().setTimeout(timeout.toMillis())
            );
            return true;
        } catch (TimeoutError e) {
            log.debug("Tab {} did not finish loading within {}", page.url(), timeout);
            return false;
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed waiting for tab load", e);
        }
    }

    @Override
    public String url() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read tab url", e);
        }
    }

    @Override
    public void close() {
        if (page.isClosed()) {
            return;
        }
        try {
            page.close();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to close tab", e);
        }
    }
}
