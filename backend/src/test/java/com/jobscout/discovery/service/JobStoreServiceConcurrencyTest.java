package com.jobscout.discovery.service;

import com.jobscout.discovery.TestJobs;
import com.jobscout.discovery.model.InsertResult;
import com.jobscout.discovery.model.ResolvedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
class JobStoreServiceConcurrencyTest {

    @Autowired
    private JobStoreService store;

    @BeforeEach
    void clearBefore() {
        store.clearAll();
    }

    @AfterEach
    void clearAfter() {
        store.clearAll();
    }

    @Test
    void concurrentInsertsOfSameJobStoreExactlyOnce() throws Exception {
        ResolvedJob job = TestJobs.job("Data Analyst", "Acme", "https://jobs.acme.com/concurrent");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<InsertResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<InsertResult> insert = () -> {
                    start.await();
                    return store.insert(job);
                };
                futures.add(executor.submit(insert));
            }
            start.countDown();

            int inserted = 0;
            for (Future<InsertResult> future : futures) {
                if (future.get() == InsertResult.INSERTED) {
                    inserted++;
                }
            }
            assertEquals(1, inserted);
            assertEquals(1, store.stats().total());
        } finally {
            executor.shutdownNow();
        }
    }
}
