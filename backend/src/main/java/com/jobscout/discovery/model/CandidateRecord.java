package com.jobscout.discovery.model;

/**
 * Raw listing fields as they appeared on a results page. {@code rawSalary} and {@code postedText}
 * are null when the listing does not show them.
 */
public record CandidateRecord(
    String rawTitle,
    String rawCompany,
    String rawLocation,
    String rawSalary,
    String postedText,
    String rawSummary,
    String listingUrl,
    String sourceKeyword,
    int sourcePage,
    ListingHandle listingHandle
) {
}
