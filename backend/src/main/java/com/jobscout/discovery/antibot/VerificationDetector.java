package com.jobscout.discovery.antibot;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.browser.BrowserSession;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizes CAPTCHA and "are you human" interstitials by DOM markers, page title and body text.
 * Titles must be an interstitial title as a whole, and body phrases only count on pages without
 * job links, so a results page that mentions "security check" in a summary stays clear.
 */
@Component
public class VerificationDetector {
    private static final List<String> SELECTORS = List.of(
        ".captcha",
        "#captcha",
        ".g-recaptcha",
        ".h-captcha",
        "iframe[src*='recaptcha']",
        "iframe[src*='hcaptcha']",
        "iframe[src*='captcha']",
        "[data-testid*='verification']",
        ".verification",
        "#verification",
        ".cf-browser-verification",
        "#challenge-form"
    );
    private static final Pattern INTERSTITIAL_TITLE = Pattern.compile(
        "^(just a moment|attention required|are you a robot|verify you are human|human verification"
            + "|verification required|security check|captcha|access denied|checking your browser)"
            + "\\s*([|:!?.\\-].*)?$"
    );
    private static final String DEFAULT_JOB_LINK_MARKER = "/job/";
    private static final List<String> BODY_PHRASES = List.of(
        "verify you are human",
        "prove you are not a robot",
        "security check",
        "checking your browser",
        "are you a robot"
    );

    private final String jobLinkSelector;

    public VerificationDetector() {
        this(DEFAULT_JOB_LINK_MARKER);
    }

    @Autowired
    public VerificationDetector(DiscoveryProperties properties) {
        this(properties.getSite().getJobDetailPathMarker());
    }

    private VerificationDetector(String jobLinkMarker) {
        String marker = jobLinkMarker == null || jobLinkMarker.isBlank() ? DEFAULT_JOB_LINK_MARKER : jobLinkMarker;
        this.jobLinkSelector = "a[href*='" + marker.replace("'", "") + "']";
    }

    public Optional<String> detect(BrowserSession session) {
        for (String selector : SELECTORS) {
            if (session.hasElement(selector)) {
                return Optional.of("selector:" + selector);
            }
        }
        String title = session.title();
        if (title != null && INTERSTITIAL_TITLE.matcher(title.trim().toLowerCase(Locale.ROOT)).matches()) {
            return Optional.of("title:" + title.trim());
        }
        if (session.hasElement(jobLinkSelector)) {
            return Optional.empty();
        }
        String body = session.bodyText();
        if (body != null) {
            String lowerBody = body.toLowerCase(Locale.ROOT);
            for (String phrase : BODY_PHRASES) {
                if (lowerBody.contains(phrase)) {
                    return Optional.of("body:" + phrase);
                }
            }
        }
        return Optional.empty();
    }

    public void check(BrowserSession session) {
        Optional<String> signal = detect(session);
        if (signal.isPresent()) {
            throw new VerificationRequiredException(session.currentUrl(), signal.get());
        }
    }
}
