package com.jobscout.discovery.service;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.model.InsertResult;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoreStats;
import com.jobscout.discovery.model.StoredJob;
import com.jobscout.discovery.persistence.DiscoveredJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The deduplicating job store. Inserts are serialized; reads go straight to the repository.
 * Storage failures propagate as Spring {@code DataAccessException}s.
 */
@Service
public class JobStoreService {
    private static final Logger log = LoggerFactory.getLogger(JobStoreService.class);

    private final DiscoveredJobRepository repository;
    private final DiscoveryProperties properties;
    private final ReentrantLock insertLock = new ReentrantLock();

    public JobStoreService(DiscoveredJobRepository repository, DiscoveryProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public InsertResult insert(ResolvedJob job) {
        insertLock.lock();
        try {
            return repository.insert(job, Instant.now());
        } finally {
            insertLock.unlock();
        }
    }

    public StoreStats stats() {
        return new StoreStats(
            repository.countAll(),
            repository.countApplied(),
            repository.countBySite(),
            repository.countByCompany(properties.getStore().getStatsCompanyLimit()),
            repository.countByAtsVendor()
        );
    }

    public int clearAll() {
        insertLock.lock();
        try {
            int deleted = repository.deleteAll();
            log.info("Cleared {} stored jobs", deleted);
            return deleted;
        } finally {
            insertLock.unlock();
        }
    }

    public Optional<StoredJob> findByFingerprint(String fingerprint) {
        return repository.findByFingerprint(fingerprint);
    }

    public List<StoredJob> findRecent(int days, int limit) {
        Instant since = Instant.now().minus(Duration.ofDays(Math.max(0, days)));
        return repository.findFirstSeenSince(since, limit);
    }

    public List<StoredJob> findDiscoveredSince(Instant since, int limit) {
        return repository.findFirstSeenSince(since, limit);
    }

    public List<StoredJob> findByCompany(String company, int limit) {
        return repository.findByCompany(company, limit);
    }

    public List<StoredJob> findUnapplied(int limit) {
        return repository.findUnapplied(limit);
    }

    public boolean markApplied(String fingerprint) {
        return repository.markApplied(fingerprint, Instant.now());
    }

    public int deleteOlderThan(int retentionDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(Math.max(1, retentionDays)));
        insertLock.lock();
        try {
            return repository.deleteFirstSeenBefore(cutoff);
        } finally {
            insertLock.unlock();
        }
    }
}
