package com.jobscout.discovery.model;

public enum DiscoveryFailure {
    EXTRACTION_EMPTY(false),
    RESOLUTION_TIMEOUT(false),
    RESOLUTION_FALLBACK(false),
    VERIFICATION_REQUIRED(true),
    STORE_DUPLICATE(false),
    STORE_FAILED(true),
    PAGE_FAILED(true),
    CANDIDATE_FAILED(true),
    WORKER_FATAL(true);

    private final boolean error;

    DiscoveryFailure(boolean error) {
        this.error = error;
    }

    /**
     * False for outcomes that are part of normal operation, such as the end of pagination.
     */
    public boolean isError() {
        return error;
    }
}
