package com.jobscout.discovery.model;

/**
 * Per-keyword totals for one run. {@code endReason} is one of {@code end_of_results},
 * {@code no_admitted_jobs}, {@code page_limit} or {@code unfinished}.
 */
public record KeywordStats(
    String keyword,
    int pagesScraped,
    int jobsFound,
    int jobsAdmitted,
    String endReason
) {
}
