package com.jobscout.discovery.model;

import java.time.Instant;

public record StoredJob(
    long id,
    ResolvedJob job,
    Instant firstSeenAt,
    boolean applied,
    Instant appliedAt
) {
}
