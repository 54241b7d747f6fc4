package com.jobscout.discovery.persistence;

import com.jobscout.discovery.TestJobs;
import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.AtsVendor;
import com.jobscout.discovery.model.InsertResult;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoredJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DiscoveredJobRepositoryTest {

    @Autowired
    private DiscoveredJobRepository repository;

    @BeforeEach
    void clear() {
        repository.deleteAll();
    }

    @Test
    void secondInsertOfSameFingerprintIsAlreadyPresent() {
        ResolvedJob job = TestJobs.job("Data Analyst", "Acme", "https://jobs.acme.com/1");

        assertEquals(InsertResult.INSERTED, repository.insert(job, Instant.now()));
        assertEquals(InsertResult.ALREADY_PRESENT, repository.insert(job, Instant.now()));
        assertEquals(1, repository.countAll());
    }

    @Test
    void storedJobRoundTripsAllFields() {
        ResolvedJob job = TestJobs.job("Data Analyst", "Acme", "https://acme.wd3.myworkdayjobs.com/x/1", AtsVendor.WORKDAY);
        repository.insert(job, Instant.now());

        StoredJob stored = repository.findByFingerprint(job.fingerprint()).orElseThrow();

        assertEquals(job.title(), stored.job().title());
        assertEquals(job.applyUrl(), stored.job().applyUrl());
        assertEquals(AtsVendor.WORKDAY, stored.job().atsVendor());
        assertEquals(AgeBucket.DAYS, stored.job().postedAge().bucket());
        assertEquals(2, stored.job().postedAge().amount());
        assertEquals("data analyst", stored.job().sourceKeyword());
        assertTrue(stored.job().resolved());
        assertFalse(stored.applied());
    }

    @Test
    void markAppliedKeepsFirstApplicationTime() {
        ResolvedJob job = TestJobs.job("BI Analyst", "Globex", "https://jobs.globex.com/7");
        repository.insert(job, Instant.now());
        Instant first = Instant.parse("2026-03-01T12:00:00Z");

        assertTrue(repository.markApplied(job.fingerprint(), first));
        assertTrue(repository.markApplied(job.fingerprint(), first.plus(Duration.ofDays(1))));
        assertFalse(repository.markApplied("missing", first));

        StoredJob stored = repository.findByFingerprint(job.fingerprint()).orElseThrow();
        assertTrue(stored.applied());
        assertEquals(first, stored.appliedAt());
        assertEquals(1, repository.countApplied());
        assertTrue(repository.findUnapplied(10).isEmpty());
    }

    @Test
    void retentionDeletesOnlyOldRows() {
        Instant now = Instant.now();
        repository.insert(TestJobs.job("Old Analyst", "Acme", "https://jobs.acme.com/old"), now.minus(Duration.ofDays(20)));
        repository.insert(TestJobs.job("New Analyst", "Acme", "https://jobs.acme.com/new"), now);

        assertEquals(1, repository.deleteFirstSeenBefore(now.minus(Duration.ofDays(14))));

        List<StoredJob> remaining = repository.findFirstSeenSince(now.minus(Duration.ofDays(30)), 10);
        assertThat(remaining).extracting(stored -> stored.job().title()).containsExactly("New Analyst");
    }

    @Test
    void groupCountsAreOrderedByVolume() {
        repository.insert(TestJobs.job("Analyst A", "Acme", "https://boards.greenhouse.io/acme/1", AtsVendor.GREENHOUSE), Instant.now());
        repository.insert(TestJobs.job("Analyst B", "Acme", "https://boards.greenhouse.io/acme/2", AtsVendor.GREENHOUSE), Instant.now());
        repository.insert(TestJobs.job("Analyst C", "Globex", "https://jobs.globex.com/3"), Instant.now());

        assertThat(repository.countByCompany(10)).containsExactly(
            entry("Acme", 2L),
            entry("Globex", 1L)
        );
        assertEquals(2L, repository.countByAtsVendor().get("GREENHOUSE"));
        assertEquals(3L, repository.countBySite().get("eluta"));
        assertEquals(2, repository.findByCompany("  ACME ", 10).size());
    }
}
