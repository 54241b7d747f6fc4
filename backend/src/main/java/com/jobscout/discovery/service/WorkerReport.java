package com.jobscout.discovery.service;

import com.jobscout.discovery.model.DiscoveryFailure;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.KeywordStats;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.resolve.UrlResolver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counters written by exactly one worker thread and read by the orchestrator after that worker's
 * future has completed.
 */
class WorkerReport {
    private final String workerId;
    private final Map<DiscoveryFailure, Integer> failures = new EnumMap<>(DiscoveryFailure.class);
    private final List<ResolvedJob> admittedJobs = new ArrayList<>();
    private int pagesScraped;
    private int jobsFound;
    private int jobsAdmitted;
    private int jobsSaved;
    private int duplicatesSkipped;
    private int rejectedTooOld;
    private int rejectedTooSenior;
    private int resolvedUrls;
    private int fallbackUrls;
    private int tabsClosed;
    private int extractionEmptyPages;
    private int suspectedCount;
    private int recoveredCount;
    private boolean abandoned;

    WorkerReport(String workerId) {
        this.workerId = workerId;
    }

    String workerId() {
        return workerId;
    }

    void pageCompleted(PageOutcome outcome) {
        pagesScraped++;
        jobsFound += outcome.candidates();
        if (outcome.isEmpty()) {
            extractionEmptyPages++;
        }
    }

    void resolution(UrlResolver.Resolution resolution) {
        tabsClosed += resolution.tabsClosed();
        if (resolution.outcome().isResolved()) {
            resolvedUrls++;
            return;
        }
        fallbackUrls++;
        failure(resolution.timedOut() ? DiscoveryFailure.RESOLUTION_TIMEOUT : DiscoveryFailure.RESOLUTION_FALLBACK);
    }

    void rejected(FilterDecision decision) {
        if (decision == FilterDecision.TOO_OLD) {
            rejectedTooOld++;
        } else if (decision == FilterDecision.TOO_SENIOR) {
            rejectedTooSenior++;
        }
    }

    void admitted(ResolvedJob job) {
        jobsAdmitted++;
        admittedJobs.add(job);
    }

    void saved() {
        jobsSaved++;
    }

    void duplicate() {
        duplicatesSkipped++;
    }

    void suspected() {
        suspectedCount++;
    }

    void recovered() {
        recoveredCount++;
    }

    void abandoned() {
        abandoned = true;
    }

    void failure(DiscoveryFailure failure) {
        failures.merge(failure, 1, Integer::sum);
    }

    static DiscoveryStats merge(
        Long runId,
        Instant startedAt,
        Instant finishedAt,
        int keywordsProcessed,
        List<KeywordStats> keywordStats,
        boolean stopped,
        List<WorkerReport> reports
    ) {
        Map<DiscoveryFailure, Integer> failures = new EnumMap<>(DiscoveryFailure.class);
        List<ResolvedJob> admittedJobs = new ArrayList<>();
        int pages = 0;
        int found = 0;
        int admitted = 0;
        int saved = 0;
        int duplicates = 0;
        int tooOld = 0;
        int tooSenior = 0;
        int resolved = 0;
        int fallback = 0;
        int tabs = 0;
        int emptyPages = 0;
        int suspected = 0;
        int recovered = 0;
        int abandonedWorkers = 0;
        for (WorkerReport report : reports) {
            pages += report.pagesScraped;
            found += report.jobsFound;
            admitted += report.jobsAdmitted;
            saved += report.jobsSaved;
            duplicates += report.duplicatesSkipped;
            tooOld += report.rejectedTooOld;
            tooSenior += report.rejectedTooSenior;
            resolved += report.resolvedUrls;
            fallback += report.fallbackUrls;
            tabs += report.tabsClosed;
            emptyPages += report.extractionEmptyPages;
            suspected += report.suspectedCount;
            recovered += report.recoveredCount;
            abandonedWorkers += report.abandoned ? 1 : 0;
            admittedJobs.addAll(report.admittedJobs);
            report.failures.forEach((failure, count) -> failures.merge(failure, count, Integer::sum));
        }
        int errors = 0;
        for (Map.Entry<DiscoveryFailure, Integer> entry : failures.entrySet()) {
            if (entry.getKey().isError()) {
                errors += entry.getValue();
            }
        }
        return new DiscoveryStats(
            runId,
            startedAt,
            finishedAt,
            keywordsProcessed,
            pages,
            found,
            admitted,
            saved,
            duplicates,
            tooOld,
            tooSenior,
            resolved,
            fallback,
            tabs,
            emptyPages,
            suspected,
            recovered,
            abandonedWorkers,
            errors,
            Map.copyOf(failures),
            List.copyOf(keywordStats),
            List.copyOf(admittedJobs),
            stopped
        );
    }
}
