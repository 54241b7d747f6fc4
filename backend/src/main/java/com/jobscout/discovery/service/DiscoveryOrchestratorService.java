package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.antibot.RecoveryStrategy;
import com.jobscout.discovery.antibot.VerificationDetector;
import com.jobscout.discovery.browser.BrowserSessionFactory;
import com.jobscout.discovery.extract.ListingExtractor;
import com.jobscout.discovery.filter.RecencyRelevanceFilter;
import com.jobscout.discovery.filter.SeniorityPolicy;
import com.jobscout.discovery.model.DiscoveryFailure;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.persistence.DiscoveryRunRepository;
import com.jobscout.discovery.resolve.UrlResolver;
import com.jobscout.discovery.site.SiteAdapter;
import com.jobscout.discovery.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class DiscoveryOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestratorService.class);
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final DiscoveryProperties properties;
    private final DiscoveryWorker.Collaborators collaborators;
    private final DiscoveryRunRepository runRepository;
    private final DiscoveryListener listener;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile KeywordWorkQueue activeQueue;

    public DiscoveryOrchestratorService(
        DiscoveryProperties properties,
        BrowserSessionFactory sessionFactory,
        SiteAdapter site,
        ListingExtractor extractor,
        UrlResolver resolver,
        RecencyRelevanceFilter filter,
        VerificationDetector detector,
        JobStoreService store,
        SessionStateStore sessionStateStore,
        RecoveryStrategy recoveryStrategy,
        Pacer pacer,
        DiscoveryRunRepository runRepository,
        List<DiscoveryListener> listeners
    ) {
        this.properties = properties;
        this.runRepository = runRepository;
        this.listener = new CompositeDiscoveryListener(listeners);
        this.collaborators = new DiscoveryWorker.Collaborators(
            sessionFactory,
            site,
            extractor,
            resolver,
            filter,
            detector,
            store,
            sessionStateStore,
            recoveryStrategy,
            pacer,
            listener
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Lets in-flight pages finish, then ends the current run.
     */
    public void stop() {
        stopRequested.set(true);
        KeywordWorkQueue queue = activeQueue;
        if (queue != null) {
            queue.close();
        }
    }

    public DiscoveryStats run() {
        return run(properties.getKeywords(), properties.getPagesPerKeyword(), properties.getWorkerCount());
    }

    public DiscoveryStats run(List<String> keywords, int pagesPerKeyword, int workerCount) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveDiscoveryRunException("A discovery run is already in progress");
        }
        stopRequested.set(false);
        Instant startedAt = Instant.now();
        try {
            List<String> normalized = normalizeKeywords(keywords);
            if (normalized.isEmpty()) {
                log.warn("Discovery run requested with no keywords");
                return DiscoveryStats.empty(startedAt);
            }
            return execute(normalized, Math.max(1, pagesPerKeyword), Math.max(1, workerCount), startedAt);
        } finally {
            activeQueue = null;
            running.set(false);
        }
    }

    private DiscoveryStats execute(List<String> keywords, int pagesPerKeyword, int workerCount, Instant startedAt) {
        long runId = runRepository.insertRun(startedAt, keywords);
        int workers = Math.min(workerCount, keywords.size());
        KeywordWorkQueue queue = new KeywordWorkQueue(
            keywords,
            pagesPerKeyword,
            properties.getMaxRetries(),
            properties.getZeroAdmittedPageThreshold()
        );
        activeQueue = queue;
        if (stopRequested.get()) {
            queue.close();
        }
        listener.onRunStarted(runId, keywords.size(), pagesPerKeyword, workers);

        DiscoveryWorker.Settings settings = new DiscoveryWorker.Settings(
            properties.getCutoffDays(),
            SeniorityPolicy.from(properties.getFilter()),
            properties.getMaxJobsPerPage(),
            properties.getAntiBot().getMaxRecoveryAttempts(),
            properties.getPacing()
        );

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("discovery-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        CompletionService<WorkerReport> completion = new ExecutorCompletionService<>(executor);
        Map<Future<WorkerReport>, WorkerReport> inFlight = new IdentityHashMap<>();
        List<WorkerReport> reports = new ArrayList<>();
        int replacements = 0;
        boolean interrupted = false;
        try {
            for (int i = 1; i <= workers; i++) {
                submitWorker("worker-" + i, settings, queue, completion, inFlight, reports);
            }
            while (!inFlight.isEmpty()) {
                Future<WorkerReport> done = completion.poll(HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
                if (done == null) {
                    runRepository.updateHeartbeat(runId, Instant.now());
                    continue;
                }
                WorkerReport report = inFlight.remove(done);
                try {
                    done.get();
                } catch (ExecutionException e) {
                    log.warn("Discovery {} failed", report.workerId(), e.getCause());
                    report.failure(DiscoveryFailure.WORKER_FATAL);
                    if (!stopRequested.get() && !queue.isDrained() && replacements < workers) {
                        replacements++;
                        submitWorker("worker-" + (workers + replacements), settings, queue, completion, inFlight, reports);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            log.warn("Discovery run {} interrupted", runId);
        } finally {
            queue.close();
            executor.shutdownNow();
        }

        boolean stopped = stopRequested.get() || interrupted;
        Instant finishedAt = Instant.now();
        DiscoveryStats stats = WorkerReport.merge(
            runId,
            startedAt,
            finishedAt,
            queue.keywordsProcessed(),
            queue.keywordStats(),
            stopped,
            reports
        );
        String status = stopped ? "STOPPED" : queue.isDrained() ? "COMPLETED" : "INCOMPLETE";
        runRepository.completeRun(runId, status, stats, "keywords=" + queue.endReasons());
        listener.onRunCompleted(stats);
        return stats;
    }

    private void submitWorker(
        String workerId,
        DiscoveryWorker.Settings settings,
        KeywordWorkQueue queue,
        CompletionService<WorkerReport> completion,
        Map<Future<WorkerReport>, WorkerReport> inFlight,
        List<WorkerReport> reports
    ) {
        WorkerReport report = new WorkerReport(workerId);
        reports.add(report);
        DiscoveryWorker worker = new DiscoveryWorker(collaborators, settings, queue, stopRequested, report);
        inFlight.put(completion.submit(worker), report);
    }

    private List<String> normalizeKeywords(List<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords == null) {
            return List.of();
        }
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                out.add(keyword.trim());
            }
        }
        return new ArrayList<>(out);
    }
}
