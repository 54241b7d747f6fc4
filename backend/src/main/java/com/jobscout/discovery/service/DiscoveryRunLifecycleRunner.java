package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.model.DiscoveryRunMeta;
import com.jobscout.discovery.persistence.DiscoveredJobRepository;
import com.jobscout.discovery.persistence.DiscoveryRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
@Order(0)
public class DiscoveryRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunLifecycleRunner.class);

    private final DiscoveredJobRepository jobRepository;
    private final DiscoveryRunRepository runRepository;
    private final JobStoreService store;
    private final DiscoveryProperties properties;

    public DiscoveryRunLifecycleRunner(
        DiscoveredJobRepository jobRepository,
        DiscoveryRunRepository runRepository,
        JobStoreService store,
        DiscoveryProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.store = store;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = jobRepository.isDbReachable();
        } catch (DataAccessException e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping discovery startup housekeeping because database is unreachable");
            return;
        }

        abortStaleRuns(Instant.now());

        if (properties.getStore().isCleanupOnStartup()) {
            int removed = store.deleteOlderThan(properties.getStore().getRetentionDays());
            if (removed > 0) {
                log.info("Removed {} jobs first seen more than {} days ago", removed, properties.getStore().getRetentionDays());
            }
        }
    }

    int abortStaleRuns(Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<DiscoveryRunMeta> running = runRepository.findRunningRuns();
        int aborted = 0;
        for (DiscoveryRunMeta run : running) {
            Instant lastSign = run.lastHeartbeatAt() != null ? run.lastHeartbeatAt() : run.startedAt();
            if (lastSign.isAfter(cutoff)) {
                continue;
            }
            runRepository.abortRun(run.runId(), now, "aborted_on_startup_stale_heartbeat");
            aborted++;
            log.info("Aborted stale discovery run {} startedAt={} lastHeartbeat={}", run.runId(), run.startedAt(), run.lastHeartbeatAt());
        }
        return aborted;
    }
}
