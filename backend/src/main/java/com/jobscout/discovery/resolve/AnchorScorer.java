package com.jobscout.discovery.resolve;

import com.jobscout.discovery.browser.PageElement;
import com.jobscout.discovery.site.SiteAdapter;
import com.jobscout.discovery.util.JobUrlUtils;
import com.jobscout.discovery.util.TextUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the anchor inside a listing container most likely to lead to the posting.
 */
class AnchorScorer {
    static final int TEXT_LENGTH_POINTS = 10;
    static final int JOB_DETAIL_POINTS = 20;
    static final int ROLE_KEYWORD_POINTS = 5;
    static final int NAVIGATION_PENALTY = 10;

    record ScoredAnchor(PageElement element, String text, String href, int score) {
    }

    private final SiteAdapter site;
    private final int minTextLength;

    AnchorScorer(SiteAdapter site, int minTextLength) {
        this.site = site;
        this.minTextLength = minTextLength;
    }

    Optional<ScoredAnchor> best(List<PageElement> anchors, String baseUrl) {
        ScoredAnchor best = null;
        for (PageElement anchor : anchors) {
            ScoredAnchor scored = score(anchor, baseUrl);
            if (scored.score() <= 0) {
                continue;
            }
            if (best == null || scored.score() > best.score()) {
                best = scored;
            }
        }
        return Optional.ofNullable(best);
    }

    ScoredAnchor score(PageElement anchor, String baseUrl) {
        String text = TextUtils.collapseWhitespace(anchor.text());
        text = text == null ? "" : text;
        String rawHref = anchor.attribute("href");
        String href = JobUrlUtils.absolutize(baseUrl, rawHref);

        int score = 0;
        if (text.length() >= minTextLength) {
            score += TEXT_LENGTH_POINTS;
        }
        if (href != null && site.isJobDetailLink(href)) {
            score += JOB_DETAIL_POINTS;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, site.roleKeywords())) {
            score += ROLE_KEYWORD_POINTS;
        }
        if (isNavigation(lower)) {
            score -= NAVIGATION_PENALTY;
        }
        return new ScoredAnchor(anchor, text, href, score);
    }

    private boolean isNavigation(String lowerText) {
        for (String keyword : site.navigationKeywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String normalized = keyword.toLowerCase(Locale.ROOT).trim();
            if (lowerText.equals(normalized)
                || lowerText.startsWith(normalized + " ")
                || lowerText.endsWith(" " + normalized)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsAny(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && lowerText.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
