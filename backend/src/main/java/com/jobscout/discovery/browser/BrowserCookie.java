package com.jobscout.discovery.browser;

/**
 * Browser-neutral cookie. {@code expires} is epoch seconds, or -1 for a session cookie.
 */
public record BrowserCookie(
    String name,
    String value,
    String domain,
    String path,
    double expires,
    boolean httpOnly,
    boolean secure,
    String sameSite
) {
}
