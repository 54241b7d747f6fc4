package com.jobscout.discovery.service;

import com.jobscout.discovery.model.AntiBotState;
import com.jobscout.discovery.model.DiscoveryFailure;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.WorkItem;

/**
 * Progress callbacks from a discovery run. Invoked from worker threads; implementations must be
 * thread-safe. All methods default to no-ops.
 */
public interface DiscoveryListener {
    default void onRunStarted(long runId, int keywords, int pagesPerKeyword, int workers) {
    }

    default void onPageCompleted(String workerId, WorkItem item, PageOutcome outcome) {
    }

    default void onJobRejected(String workerId, ResolvedJob job, FilterDecision decision) {
    }

    default void onJobSaved(String workerId, ResolvedJob job) {
    }

    default void onDuplicate(String workerId, ResolvedJob job) {
    }

    default void onFailure(String workerId, WorkItem item, DiscoveryFailure failure, Throwable error) {
    }

    default void onAntiBotTransition(String workerId, AntiBotState from, AntiBotState to, String detail) {
    }

    default void onRunCompleted(DiscoveryStats stats) {
    }
}
