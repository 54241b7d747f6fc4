package com.jobscout.discovery.browser;

import java.time.Duration;

class FakeTab implements BrowserTab {
    private final FakeBrowserSession session;
    private final String url;
    private boolean closed;

    FakeTab(FakeBrowserSession session, String url) {
        this.session = session;
        this.url = url;
    }

    @Override
    public boolean awaitLoad(Duration timeout) {
        return true;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            session.tabClosed();
        }
    }
}
