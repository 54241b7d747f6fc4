package com.jobscout.discovery.antibot;

import com.jobscout.discovery.browser.BrowserCookie;

import java.util.List;

public record RecoveryRequest(
    String workerId,
    String blockedUrl,
    String signal,
    List<BrowserCookie> cookies,
    int attempt
) {
}
