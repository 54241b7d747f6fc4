package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.model.KeywordStats;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoredJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(10)
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final DiscoveryProperties properties;
    private final DiscoveryOrchestratorService orchestratorService;
    private final JobStoreService store;
    private final JobExportService exportService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        DiscoveryProperties properties,
        DiscoveryOrchestratorService orchestratorService,
        JobStoreService store,
        JobExportService exportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.store = store;
        this.exportService = exportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        DiscoveryStats stats = orchestratorService.run();
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
        if (!stats.errorsByCategory().isEmpty()) {
            log.info("Failures by category: {}", stats.errorsByCategory());
        }
        for (KeywordStats keyword : stats.keywordStats()) {
            log.info(
                "Keyword '{}': pages={}, found={}, admitted={}, ended={}",
                keyword.keyword(),
                keyword.pagesScraped(),
                keyword.jobsFound(),
                keyword.jobsAdmitted(),
                keyword.endReason()
            );
        }

        String exportPath = properties.getCli().getExportPath();
        if (exportPath != null && !exportPath.isBlank()) {
            export(stats, Path.of(exportPath.trim()));
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private void export(DiscoveryStats stats, Path target) {
        List<StoredJob> jobs = new ArrayList<>();
        for (ResolvedJob job : stats.admittedJobs()) {
            // jobs whose insert failed are exported without store metadata
            jobs.add(store.findByFingerprint(job.fingerprint())
                .orElseGet(() -> new StoredJob(0L, job, job.scrapedAt(), false, null)));
        }
        try {
            JobExportService.Format format = JobExportService.Format.parse(properties.getCli().getExportFormat());
            int written = exportService.export(jobs, target, format);
            log.info("Exported {} jobs to {}", written, target.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to export discovered jobs to {}", target, e);
        }
    }
}
