package com.jobscout.discovery.service;

import com.jobscout.discovery.model.AntiBotState;
import com.jobscout.discovery.model.DiscoveryFailure;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans callbacks out to every registered listener. A failing listener is logged and skipped.
 */
class CompositeDiscoveryListener implements DiscoveryListener {
    private static final Logger log = LoggerFactory.getLogger(CompositeDiscoveryListener.class);

    private final List<DiscoveryListener> delegates;

    CompositeDiscoveryListener(List<DiscoveryListener> delegates) {
        this.delegates = delegates == null ? List.of() : List.copyOf(delegates);
    }

    @Override
    public void onRunStarted(long runId, int keywords, int pagesPerKeyword, int workers) {
        each(listener -> listener.onRunStarted(runId, keywords, pagesPerKeyword, workers));
    }

    @Override
    public void onPageCompleted(String workerId, WorkItem item, PageOutcome outcome) {
        each(listener -> listener.onPageCompleted(workerId, item, outcome));
    }

    @Override
    public void onJobRejected(String workerId, ResolvedJob job, FilterDecision decision) {
        each(listener -> listener.onJobRejected(workerId, job, decision));
    }

    @Override
    public void onJobSaved(String workerId, ResolvedJob job) {
        each(listener -> listener.onJobSaved(workerId, job));
    }

    @Override
    public void onDuplicate(String workerId, ResolvedJob job) {
        each(listener -> listener.onDuplicate(workerId, job));
    }

    @Override
    public void onFailure(String workerId, WorkItem item, DiscoveryFailure failure, Throwable error) {
        each(listener -> listener.onFailure(workerId, item, failure, error));
    }

    @Override
    public void onAntiBotTransition(String workerId, AntiBotState from, AntiBotState to, String detail) {
        each(listener -> listener.onAntiBotTransition(workerId, from, to, detail));
    }

    @Override
    public void onRunCompleted(DiscoveryStats stats) {
        each(listener -> listener.onRunCompleted(stats));
    }

    private void each(Consumer<DiscoveryListener> call) {
        for (DiscoveryListener delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                log.warn("Discovery listener {} failed", delegate.getClass().getSimpleName(), e);
            }
        }
    }
}
