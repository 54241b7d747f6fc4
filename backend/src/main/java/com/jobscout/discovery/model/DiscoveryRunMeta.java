package com.jobscout.discovery.model;

import java.time.Instant;

public record DiscoveryRunMeta(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    Instant lastHeartbeatAt,
    String status,
    int pagesScraped,
    int jobsSaved
) {
}
