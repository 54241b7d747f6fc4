package com.jobscout.discovery.antibot;

import com.jobscout.discovery.browser.BrowserCookie;

import java.util.List;

public record RecoveryResult(boolean recovered, List<BrowserCookie> cookies, String detail) {

    public static RecoveryResult succeeded(List<BrowserCookie> cookies, String detail) {
        return new RecoveryResult(true, cookies == null ? List.of() : List.copyOf(cookies), detail);
    }

    public static RecoveryResult failed(String detail) {
        return new RecoveryResult(false, List.of(), detail);
    }
}
