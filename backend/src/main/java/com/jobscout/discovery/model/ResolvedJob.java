package com.jobscout.discovery.model;

import java.time.Instant;

/**
 * A listing after click-and-resolve. {@code applyUrl} is never blank: when no external URL was
 * captured it holds the original listing URL and {@code resolved} is false. {@code salary} and
 * {@code postedText} may be null.
 */
public record ResolvedJob(
    String title,
    String company,
    String location,
    String summary,
    String salary,
    String applyUrl,
    String listingUrl,
    AtsVendor atsVendor,
    boolean resolved,
    String postedText,
    PostedAge postedAge,
    String site,
    String sourceKeyword,
    int sourcePage,
    String fingerprint,
    Instant scrapedAt
) {
}
