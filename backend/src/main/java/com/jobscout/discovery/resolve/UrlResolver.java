package com.jobscout.discovery.resolve;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.browser.BrowserOperationException;
import com.jobscout.discovery.browser.BrowserSession;
import com.jobscout.discovery.browser.BrowserTab;
import com.jobscout.discovery.browser.ClickOutcome;
import com.jobscout.discovery.browser.PageElement;
import com.jobscout.discovery.browser.WorkerFatalException;
import com.jobscout.discovery.filter.RecencyParser;
import com.jobscout.discovery.model.CandidateRecord;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.site.SiteAdapter;
import com.jobscout.discovery.util.JobFingerprint;
import com.jobscout.discovery.util.JobUrlUtils;
import com.jobscout.discovery.util.Pacer;
import com.jobscout.discovery.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Click-and-resolve: clicks the best anchor of a listing, captures where it leads and always puts
 * the session back on the results page with no extra tabs open.
 */
@Component
public class UrlResolver {
    private static final Logger log = LoggerFactory.getLogger(UrlResolver.class);
    private static final int MAX_TITLE_LENGTH = 300;
    private static final int MAX_SALARY_LENGTH = 120;

    public enum Outcome {
        NEW_TAB,
        NAVIGATED,
        HREF_FALLBACK,
        LISTING_FALLBACK;

        public boolean isResolved() {
            return this == NEW_TAB || this == NAVIGATED;
        }
    }

    public record Resolution(ResolvedJob job, Outcome outcome, boolean timedOut, int tabsClosed) {
    }

    private record Capture(ClickOutcome.Kind kind, String url, String href) {
        static Capture nothing(String href) {
            return new Capture(ClickOutcome.Kind.NONE, null, href);
        }
    }

    private final SiteAdapter site;
    private final AtsVendorClassifier vendorClassifier;
    private final RecencyParser recencyParser;
    private final Pacer pacer;
    private final DiscoveryProperties.Resolver settings;
    private final AnchorScorer anchorScorer;

    public UrlResolver(
        SiteAdapter site,
        AtsVendorClassifier vendorClassifier,
        RecencyParser recencyParser,
        Pacer pacer,
        DiscoveryProperties properties
    ) {
        this.site = site;
        this.vendorClassifier = vendorClassifier;
        this.recencyParser = recencyParser;
        this.pacer = pacer;
        this.settings = properties.getResolver();
        this.anchorScorer = new AnchorScorer(site, settings.getMinAnchorTextLength());
    }

    public ResolvedJob resolve(CandidateRecord candidate, BrowserSession session) {
        return resolveWithOutcome(candidate, session).job();
    }

    public Resolution resolveWithOutcome(CandidateRecord candidate, BrowserSession session) {
        String listingPage = candidate.listingHandle().resultsUrl();
        int baselineTabs = session.openTabCount();
        Capture capture = Capture.nothing(null);
        int tabsClosed = 0;
        try {
            capture = capture(candidate, session, listingPage);
        } catch (BrowserOperationException e) {
            log.warn("Resolution failed for '{}' ({}): {}", candidate.rawTitle(), candidate.listingUrl(), e.getMessage());
        } finally {
            tabsClosed = restore(session, listingPage, baselineTabs);
        }
        return build(candidate, capture, tabsClosed);
    }

    private Capture capture(CandidateRecord candidate, BrowserSession session, String listingPage) {
        Optional<PageElement> container = session.querySelector(candidate.listingHandle().selector());
        if (container.isEmpty()) {
            log.debug("Listing container for '{}' is no longer on the page", candidate.rawTitle());
            return Capture.nothing(null);
        }
        List<PageElement> anchors = container.get().findAll("a[href]");
        Optional<AnchorScorer.ScoredAnchor> best = anchorScorer.best(anchors, listingPage);
        if (best.isEmpty()) {
            log.debug("No clickable anchor scored above zero for '{}'", candidate.rawTitle());
            return Capture.nothing(null);
        }

        AnchorScorer.ScoredAnchor anchor = best.get();
        anchor.element().scrollIntoView();
        anchor.element().hover();
        pacer.pauseBetween(settings.getPreClickMinMs(), settings.getPreClickMaxMs());

        Duration clickTimeout = Duration.ofMillis(settings.getClickTimeoutMs());
        ClickOutcome outcome = session.clickAndAwait(anchor.element(), clickTimeout);
        if (outcome.kind() == ClickOutcome.Kind.NEW_TAB) {
            try (BrowserTab tab = outcome.tab()) {
                tab.awaitLoad(clickTimeout);
                pacer.pause(Duration.ofMillis(settings.getSettleMs()));
                return new Capture(ClickOutcome.Kind.NEW_TAB, tab.url(), anchor.href());
            }
        }
        if (outcome.kind() == ClickOutcome.Kind.NAVIGATED) {
            pacer.pause(Duration.ofMillis(settings.getSettleMs()));
            return new Capture(ClickOutcome.Kind.NAVIGATED, session.currentUrl(), anchor.href());
        }
        log.debug("Click on '{}' opened nothing within {}", candidate.rawTitle(), clickTimeout);
        return Capture.nothing(anchor.href());
    }

    private int restore(BrowserSession session, String listingPage, int baselineTabs) {
        try {
            int closed = session.closeExtraTabs();
            if (listingPage != null && !listingPage.equals(session.currentUrl())) {
                session.navigate(listingPage);
            }
            int open = session.openTabCount();
            if (open > baselineTabs) {
                log.warn("Session still has {} tabs open after restore (baseline {})", open, baselineTabs);
            }
            return closed;
        } catch (BrowserOperationException e) {
            throw new WorkerFatalException("Could not restore results page " + listingPage, e);
        }
    }

    private Resolution build(CandidateRecord candidate, Capture capture, int tabsClosed) {
        String applyUrl;
        Outcome outcome;
        String captured = capture.url();
        if (captured != null
            && JobUrlUtils.isHttpUrl(captured)
            && !JobUrlUtils.isOnDomain(captured, site.listingDomain())) {
            applyUrl = captured.trim();
            outcome = capture.kind() == ClickOutcome.Kind.NEW_TAB ? Outcome.NEW_TAB : Outcome.NAVIGATED;
        } else if (capture.href() != null && JobUrlUtils.isHttpUrl(capture.href())) {
            applyUrl = capture.href();
            outcome = Outcome.HREF_FALLBACK;
        } else {
            applyUrl = firstNonBlank(candidate.listingUrl(), candidate.listingHandle().resultsUrl());
            outcome = Outcome.LISTING_FALLBACK;
        }

        String title = TextUtils.clean(candidate.rawTitle(), MAX_TITLE_LENGTH);
        String company = TextUtils.clean(candidate.rawCompany(), MAX_TITLE_LENGTH);
        ResolvedJob job = new ResolvedJob(
            title,
            company,
            TextUtils.clean(candidate.rawLocation(), MAX_TITLE_LENGTH),
            TextUtils.clean(candidate.rawSummary(), MAX_TITLE_LENGTH),
            TextUtils.clean(candidate.rawSalary(), MAX_SALARY_LENGTH),
            applyUrl,
            candidate.listingUrl(),
            vendorClassifier.classify(applyUrl),
            outcome.isResolved(),
            TextUtils.clean(candidate.postedText(), MAX_SALARY_LENGTH),
            recencyParser.parse(candidate.postedText()),
            site.name(),
            candidate.sourceKeyword(),
            candidate.sourcePage(),
            JobFingerprint.of(title, company, applyUrl),
            Instant.now()
        );
        boolean timedOut = capture.kind() == ClickOutcome.Kind.NONE && capture.href() != null;
        return new Resolution(job, outcome, timedOut, tabsClosed);
    }

    private String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null ? "" : second.trim();
    }
}
