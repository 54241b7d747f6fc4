package com.jobscout.discovery.service;

import java.util.HashSet;
import java.util.Set;

/**
 * Candidates of one page already counted by an earlier, interrupted attempt. Owned by whichever
 * worker holds the page; handed between workers through {@link KeywordWorkQueue}.
 */
final class PageProgress {
    private final Set<String> handledFingerprints = new HashSet<>();
    private int admitted;

    /**
     * @return false when the fingerprint was already counted for this page
     */
    boolean markHandled(String fingerprint) {
        return handledFingerprints.add(fingerprint);
    }

    void admitted() {
        admitted++;
    }

    int admittedCount() {
        return admitted;
    }
}
