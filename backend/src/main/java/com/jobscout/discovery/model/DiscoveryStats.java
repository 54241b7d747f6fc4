package com.jobscout.discovery.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Totals for one run. {@code admittedJobs} holds every job that passed the filter, whether it was
 * newly stored or already known.
 */
public record DiscoveryStats(
    Long runId,
    Instant startedAt,
    Instant finishedAt,
    int keywordsProcessed,
    int pagesScraped,
    int jobsFound,
    int jobsAdmitted,
    int jobsSaved,
    int duplicatesSkipped,
    int rejectedTooOld,
    int rejectedTooSenior,
    int resolvedUrls,
    int fallbackUrls,
    int tabsClosed,
    int extractionEmptyPages,
    int suspectedCount,
    int recoveredCount,
    int abandonedWorkers,
    int errorsEncountered,
    Map<DiscoveryFailure, Integer> errorsByCategory,
    List<KeywordStats> keywordStats,
    List<ResolvedJob> admittedJobs,
    boolean stopped
) {
    public Duration elapsed() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public static DiscoveryStats empty(Instant at) {
        return new DiscoveryStats(
            null, at, at, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, Map.of(), List.of(), List.of(), false
        );
    }
}
