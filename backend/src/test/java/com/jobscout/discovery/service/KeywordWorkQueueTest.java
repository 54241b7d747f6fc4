package com.jobscout.discovery.service;

import com.jobscout.discovery.model.KeywordStats;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.WorkItem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordWorkQueueTest {

    @Test
    void emptyPageEndsKeywordEarly() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("data analyst"), 5, 2, 2);

        WorkItem first = queue.take();
        assertEquals(WorkItem.first("data analyst", 1), first);
        queue.complete(first, new PageOutcome(3, 3));

        WorkItem second = queue.take();
        assertEquals(2, second.pageNumber());
        queue.complete(second, new PageOutcome(0, 0));

        assertNull(queue.take());
        assertTrue(queue.isDrained());
        assertEquals("end_of_results", queue.endReasons().get("data analyst"));
    }

    @Test
    void pageLimitIsRespected() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 2, 0, 5);

        queue.complete(queue.take(), new PageOutcome(4, 1));
        queue.complete(queue.take(), new PageOutcome(4, 1));

        assertNull(queue.take());
        assertEquals("page_limit", queue.endReasons().get("analyst"));
    }

    @Test
    void consecutivePagesWithoutAdmittedJobsEndKeyword() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 10, 0, 2);

        queue.complete(queue.take(), new PageOutcome(5, 0));
        queue.complete(queue.take(), new PageOutcome(5, 0));

        assertNull(queue.take());
        assertEquals("no_admitted_jobs", queue.endReasons().get("analyst"));
    }

    @Test
    void failedPageIsRetriedThenSkipped() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 2, 1, 2);

        WorkItem first = queue.take();
        assertTrue(queue.fail(first));
        WorkItem retry = queue.take();
        assertEquals(1, retry.pageNumber());
        assertEquals(1, retry.attempt());
        assertFalse(queue.fail(retry));

        WorkItem next = queue.take();
        assertEquals(2, next.pageNumber());
        assertEquals(0, next.attempt());
    }

    @Test
    void requeuedItemIsHandedOutAgainUnchanged() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 3, 0, 2);

        WorkItem item = queue.take();
        queue.requeue(item);

        assertEquals(item, queue.take());
    }

    @Test
    void repeatedlyBlockedPageIsEventuallySkipped() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 3, 1, 2);

        WorkItem item = queue.take();
        assertTrue(queue.requeueBlocked(item));
        assertEquals(item, queue.take());
        assertTrue(queue.requeueBlocked(item));
        assertEquals(item, queue.take());
        assertFalse(queue.requeueBlocked(item));

        assertEquals(2, queue.take().pageNumber());
    }

    @Test
    void progressSurvivesRetriesAndResetsOnNextPage() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst"), 3, 1, 2);

        WorkItem item = queue.take();
        PageProgress progress = queue.progress(item);
        assertTrue(progress.markHandled("fp-1"));
        progress.admitted();
        queue.requeueBlocked(item);

        WorkItem again = queue.take();
        assertSame(progress, queue.progress(again));
        assertFalse(queue.progress(again).markHandled("fp-1"));
        queue.complete(again, new PageOutcome(2, progress.admittedCount()));

        WorkItem next = queue.take();
        assertNotSame(progress, queue.progress(next));
    }

    @Test
    void keywordStatsTotalCompletedPages() throws InterruptedException {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("analyst", "developer"), 5, 0, 2);

        WorkItem analyst = queue.take();
        WorkItem developer = queue.take();
        queue.complete(analyst, new PageOutcome(4, 2));
        queue.complete(queue.take(), new PageOutcome(0, 0));
        queue.fail(developer);

        List<KeywordStats> stats = queue.keywordStats();
        assertEquals(new KeywordStats("analyst", 2, 4, 2, "end_of_results"), stats.get(0));
        assertEquals(new KeywordStats("developer", 0, 0, 0, "unfinished"), stats.get(1));
    }

    @Test
    void onlyOnePagePerKeywordIsInFlight() throws Exception {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("a", "b"), 3, 0, 2);

        WorkItem a1 = queue.take();
        WorkItem b1 = queue.take();
        assertEquals("a", a1.keyword());
        assertEquals("b", b1.keyword());

        AtomicReference<WorkItem> taken = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                taken.set(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();
        assertFalse(done.await(100, TimeUnit.MILLISECONDS));

        queue.complete(b1, new PageOutcome(2, 1));
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(new WorkItem("b", 2, 0), taken.get());
        assertEquals(1, queue.keywordsProcessed());
    }

    @Test
    void closeReleasesBlockedConsumers() throws Exception {
        KeywordWorkQueue queue = new KeywordWorkQueue(List.of("a"), 3, 0, 2);
        queue.take();

        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<WorkItem> taken = new AtomicReference<>(WorkItem.first("sentinel", 1));
        Thread waiter = new Thread(() -> {
            try {
                taken.set(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();
        queue.close();

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertNull(taken.get());
        assertFalse(queue.isDrained());
        assertEquals("unfinished", queue.endReasons().get("a"));
    }
}
