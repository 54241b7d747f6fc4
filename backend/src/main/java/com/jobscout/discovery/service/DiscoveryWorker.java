package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.antibot.AntiBotStateMachine;
import com.jobscout.discovery.antibot.RecoveryResult;
import com.jobscout.discovery.antibot.RecoveryStrategy;
import com.jobscout.discovery.antibot.VerificationDetector;
import com.jobscout.discovery.antibot.VerificationRequiredException;
import com.jobscout.discovery.browser.BrowserCookie;
import com.jobscout.discovery.browser.BrowserOperationException;
import com.jobscout.discovery.browser.BrowserSession;
import com.jobscout.discovery.browser.BrowserSessionFactory;
import com.jobscout.discovery.browser.WorkerFatalException;
import com.jobscout.discovery.extract.ListingExtractor;
import com.jobscout.discovery.filter.RecencyRelevanceFilter;
import com.jobscout.discovery.filter.SeniorityPolicy;
import com.jobscout.discovery.model.CandidateRecord;
import com.jobscout.discovery.model.DiscoveryFailure;
import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.InsertResult;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.PageSnapshot;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.WorkItem;
import com.jobscout.discovery.resolve.UrlResolver;
import com.jobscout.discovery.site.SiteAdapter;
import com.jobscout.discovery.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded consumer of the work queue that owns one browser session for its lifetime.
 */
class DiscoveryWorker implements Callable<WorkerReport> {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryWorker.class);

    record Collaborators(
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
        DiscoveryListener listener
    ) {
    }

    record Settings(
        int cutoffDays,
        SeniorityPolicy seniorityPolicy,
        int maxJobsPerPage,
        int maxRecoveryAttempts,
        DiscoveryProperties.Pacing pacing
    ) {
    }

    private final Collaborators deps;
    private final Settings settings;
    private final KeywordWorkQueue queue;
    private final AtomicBoolean stopRequested;
    private final WorkerReport report;
    private final String workerId;
    private final AntiBotStateMachine antiBot;

    DiscoveryWorker(
        Collaborators deps,
        Settings settings,
        KeywordWorkQueue queue,
        AtomicBoolean stopRequested,
        WorkerReport report
    ) {
        this.deps = deps;
        this.settings = settings;
        this.queue = queue;
        this.stopRequested = stopRequested;
        this.report = report;
        this.workerId = report.workerId();
        this.antiBot = new AntiBotStateMachine(
            workerId,
            deps.recoveryStrategy(),
            settings.maxRecoveryAttempts(),
            deps.listener()::onAntiBotTransition
        );
    }

    @Override
    public WorkerReport call() {
        BrowserSession session = openSession(deps.sessionStateStore().load());
        String lastKeyword = null;
        try {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                WorkItem item = queue.take();
                if (item == null) {
                    break;
                }
                if (lastKeyword != null) {
                    paceBefore(item, lastKeyword);
                }
                lastKeyword = item.keyword();
                try {
                    PageOutcome outcome = processPage(session, item);
                    queue.complete(item, outcome);
                    report.pageCompleted(outcome);
                    if (outcome.isEmpty()) {
                        deps.listener().onFailure(workerId, item, DiscoveryFailure.EXTRACTION_EMPTY, null);
                    }
                    deps.listener().onPageCompleted(workerId, item, outcome);
                } catch (VerificationRequiredException e) {
                    if (!queue.requeueBlocked(item)) {
                        report.failure(DiscoveryFailure.PAGE_FAILED);
                    }
                    report.failure(DiscoveryFailure.VERIFICATION_REQUIRED);
                    deps.listener().onFailure(workerId, item, DiscoveryFailure.VERIFICATION_REQUIRED, e);
                    BrowserSession blocked = session;
                    session = null;
                    session = recover(blocked, e);
                    if (session == null) {
                        report.abandoned();
                        break;
                    }
                } catch (WorkerFatalException e) {
                    queue.requeue(item);
                    deps.listener().onFailure(workerId, item, DiscoveryFailure.WORKER_FATAL, e);
                    throw e;
                } catch (RuntimeException e) {
                    boolean retried = queue.fail(item);
                    report.failure(DiscoveryFailure.PAGE_FAILED);
                    deps.listener().onFailure(workerId, item, DiscoveryFailure.PAGE_FAILED, e);
                    log.debug("{} page failure on '{}' page {} (retry={})", workerId, item.keyword(), item.pageNumber(), retried, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} interrupted", workerId);
        } finally {
            closeSession(session);
        }
        return report;
    }

    PageOutcome processPage(BrowserSession session, WorkItem item) {
        String url = deps.site().searchUrl(item.keyword(), item.pageNumber());
        session.navigate(url);
        deps.detector().check(session);
        PageSnapshot snapshot = session.snapshot();
        List<CandidateRecord> candidates = deps.extractor().extract(snapshot, item);
        if (candidates.isEmpty()) {
            return new PageOutcome(0, 0);
        }

        PageProgress progress = queue.progress(item);
        int limit = Math.min(candidates.size(), settings.maxJobsPerPage());
        for (int i = 0; i < limit; i++) {
            CandidateRecord candidate = candidates.get(i);
            UrlResolver.Resolution resolution;
            try {
                resolution = deps.resolver().resolveWithOutcome(candidate, session);
            } catch (WorkerFatalException e) {
                throw e;
            } catch (RuntimeException e) {
                report.failure(DiscoveryFailure.CANDIDATE_FAILED);
                deps.listener().onFailure(workerId, item, DiscoveryFailure.CANDIDATE_FAILED, e);
                continue;
            }
            deps.detector().check(session);

            ResolvedJob job = resolution.job();
            if (!progress.markHandled(job.fingerprint())) {
                // counted by an earlier attempt of this page
                continue;
            }
            report.resolution(resolution);
            FilterDecision decision = deps.filter().evaluate(job, settings.cutoffDays(), settings.seniorityPolicy());
            if (!decision.isAdmitted()) {
                report.rejected(decision);
                deps.listener().onJobRejected(workerId, job, decision);
                continue;
            }
            progress.admitted();
            report.admitted(job);
            store(job, item);
        }
        return new PageOutcome(candidates.size(), progress.admittedCount());
    }

    private void store(ResolvedJob job, WorkItem item) {
        try {
            InsertResult result = deps.store().insert(job);
            if (result == InsertResult.INSERTED) {
                report.saved();
                deps.listener().onJobSaved(workerId, job);
            } else {
                report.duplicate();
                deps.listener().onDuplicate(workerId, job);
            }
        } catch (DataAccessException e) {
            report.failure(DiscoveryFailure.STORE_FAILED);
            deps.listener().onFailure(workerId, item, DiscoveryFailure.STORE_FAILED, e);
        }
    }

    /**
     * Always closes {@code current}.
     *
     * @return a fresh session carrying the recovered cookies, or null when the worker is abandoned
     */
    private BrowserSession recover(BrowserSession current, VerificationRequiredException block) {
        report.suspected();
        List<BrowserCookie> cookies = List.of();
        try {
            cookies = current.cookies();
        } catch (BrowserOperationException e) {
            log.warn("{} could not read cookies before recovery", workerId, e);
        }
        closeSession(current);

        RecoveryResult result = antiBot.handle(block, cookies);
        if (!result.recovered()) {
            log.warn("{} abandoned after verification at {}: {}", workerId, block.getBlockedUrl(), result.detail());
            return null;
        }
        report.recovered();
        deps.sessionStateStore().save(result.cookies());
        BrowserSession fresh = openSession(result.cookies());
        antiBot.resume();
        return fresh;
    }

    private BrowserSession openSession(List<BrowserCookie> cookies) {
        BrowserSession session;
        try {
            session = deps.sessionFactory().open();
        } catch (BrowserOperationException e) {
            throw new WorkerFatalException(workerId + " could not open a browser session", e);
        }
        if (cookies != null && !cookies.isEmpty()) {
            try {
                session.addCookies(cookies);
            } catch (BrowserOperationException e) {
                log.warn("{} could not install {} saved cookies", workerId, cookies.size(), e);
            }
        }
        return session;
    }

    private void paceBefore(WorkItem item, String lastKeyword) {
        DiscoveryProperties.Pacing pacing = settings.pacing();
        if (item.keyword().equals(lastKeyword)) {
            deps.pacer().pauseBetween(pacing.getPageDelayMinMs(), pacing.getPageDelayMaxMs());
        } else {
            deps.pacer().pauseBetween(pacing.getKeywordDelayMinMs(), pacing.getKeywordDelayMaxMs());
        }
    }

    private void closeSession(BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("{} failed to close browser session", workerId, e);
        }
    }
}
