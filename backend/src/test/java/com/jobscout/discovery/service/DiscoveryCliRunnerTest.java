package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.TestJobs;
import com.jobscout.discovery.model.DiscoveryStats;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoredJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryCliRunnerTest {

    @Mock
    private DiscoveryOrchestratorService orchestratorService;
    @Mock
    private JobStoreService store;
    @Mock
    private JobExportService exportService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    @TempDir
    Path tempDir;

    @Test
    void doesNothingUnlessEnabled() {
        DiscoveryProperties properties = new DiscoveryProperties();

        runner(properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(orchestratorService, store, exportService);
    }

    @Test
    void runsConfiguredDiscoveryAndExportsEveryAdmittedJob() throws Exception {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setExportPath(tempDir.resolve("jobs.json").toString());
        properties.getCli().setExportFormat("json");
        Instant startedAt = Instant.now();
        ResolvedJob known = TestJobs.job("Data Analyst", "Acme", "https://jobs.acme.com/1");
        ResolvedJob unsaved = TestJobs.job("BI Analyst", "Globex", "https://jobs.globex.com/2");
        WorkerReport report = new WorkerReport("worker-1");
        report.admitted(known);
        report.admitted(unsaved);
        DiscoveryStats stats = WorkerReport.merge(7L, startedAt, startedAt, 1, List.of(), false, List.of(report));
        StoredJob storedKnown = new StoredJob(3L, known, startedAt.minusSeconds(86_400), true, startedAt);
        when(orchestratorService.run()).thenReturn(stats);
        when(store.findByFingerprint(known.fingerprint())).thenReturn(Optional.of(storedKnown));
        when(store.findByFingerprint(unsaved.fingerprint())).thenReturn(Optional.empty());

        runner(properties).run(new DefaultApplicationArguments());

        verify(orchestratorService).run();
        List<StoredJob> expected = List.of(
            storedKnown,
            new StoredJob(0L, unsaved, unsaved.scrapedAt(), false, null)
        );
        verify(exportService).export(eq(expected), any(Path.class), eq(JobExportService.Format.JSON));
    }

    private DiscoveryCliRunner runner(DiscoveryProperties properties) {
        return new DiscoveryCliRunner(properties, orchestratorService, store, exportService, applicationContext);
    }
}
