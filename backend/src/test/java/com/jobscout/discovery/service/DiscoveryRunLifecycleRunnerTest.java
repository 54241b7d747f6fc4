package com.jobscout.discovery.service;

import com.jobscout.discovery.persistence.DiscoveryRunRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DiscoveryRunLifecycleRunnerTest {

    @Autowired
    private DiscoveryRunLifecycleRunner runner;
    @Autowired
    private DiscoveryRunRepository runRepository;

    @Test
    void runsWithoutRecentHeartbeatAreAborted() {
        Instant now = Instant.now();
        long stale = runRepository.insertRun(now.minus(Duration.ofHours(3)), List.of("data analyst"));
        long alive = runRepository.insertRun(now.minus(Duration.ofHours(3)), List.of("business analyst"));
        runRepository.updateHeartbeat(alive, now.minus(Duration.ofMinutes(1)));

        runner.abortStaleRuns(now);

        assertEquals("ABORTED", runRepository.findRun(stale).status());
        assertNotNull(runRepository.findRun(stale).finishedAt());
        assertEquals("RUNNING", runRepository.findRun(alive).status());
    }
}
