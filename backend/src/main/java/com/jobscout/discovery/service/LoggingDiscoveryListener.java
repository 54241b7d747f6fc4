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
import org.springframework.stereotype.Component;

@Component
public class LoggingDiscoveryListener implements DiscoveryListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiscoveryListener.class);

    @Override
    public void onRunStarted(long runId, int keywords, int pagesPerKeyword, int workers) {
        log.info("Discovery run {} started: keywords={}, pagesPerKeyword={}, workers={}", runId, keywords, pagesPerKeyword, workers);
    }

    @Override
    public void onPageCompleted(String workerId, WorkItem item, PageOutcome outcome) {
        log.info(
            "{} scraped '{}' page {}: candidates={}, admitted={}",
            workerId,
            item.keyword(),
            item.pageNumber(),
            outcome.candidates(),
            outcome.admitted()
        );
    }

    @Override
    public void onJobRejected(String workerId, ResolvedJob job, FilterDecision decision) {
        log.debug("{} rejected '{}' at {}: {}", workerId, job.title(), job.company(), decision);
    }

    @Override
    public void onJobSaved(String workerId, ResolvedJob job) {
        log.info("{} saved '{}' at {} -> {} ({})", workerId, job.title(), job.company(), job.applyUrl(), job.atsVendor());
    }

    @Override
    public void onDuplicate(String workerId, ResolvedJob job) {
        log.debug("{} skipped duplicate '{}' at {}", workerId, job.title(), job.company());
    }

    @Override
    public void onFailure(String workerId, WorkItem item, DiscoveryFailure failure, Throwable error) {
        String where = item == null ? "-" : item.keyword() + "#" + item.pageNumber();
        if (error == null) {
            log.warn("{} {} at {}", workerId, failure, where);
        } else {
            log.warn("{} {} at {}: {}", workerId, failure, where, error.getMessage());
        }
    }

    @Override
    public void onAntiBotTransition(String workerId, AntiBotState from, AntiBotState to, String detail) {
        if (to == AntiBotState.ABANDONED || to == AntiBotState.SUSPECTED) {
            log.warn("{} anti-bot {} -> {} ({})", workerId, from, to, detail);
        } else {
            log.info("{} anti-bot {} -> {} ({})", workerId, from, to, detail);
        }
    }

    @Override
    public void onRunCompleted(DiscoveryStats stats) {
        log.info(
            "Discovery run {} finished in {}s: keywords={}, pages={}, found={}, admitted={}, saved={}, duplicates={}, errors={}",
            stats.runId(),
            stats.elapsed().toSeconds(),
            stats.keywordsProcessed(),
            stats.pagesScraped(),
            stats.jobsFound(),
            stats.jobsAdmitted(),
            stats.jobsSaved(),
            stats.duplicatesSkipped(),
            stats.errorsEncountered()
        );
    }
}
