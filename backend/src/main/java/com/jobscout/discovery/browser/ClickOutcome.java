package com.jobscout.discovery.browser;

public record ClickOutcome(Kind kind, BrowserTab tab, String url) {

    public enum Kind {
        NEW_TAB,
        NAVIGATED,
        NONE
    }

    public static ClickOutcome newTab(BrowserTab tab) {
        return new ClickOutcome(Kind.NEW_TAB, tab, null);
    }

    public static ClickOutcome navigated(String url) {
        return new ClickOutcome(Kind.NAVIGATED, null, url);
    }

    public static ClickOutcome none() {
        return new ClickOutcome(Kind.NONE, null, null);
    }
}
