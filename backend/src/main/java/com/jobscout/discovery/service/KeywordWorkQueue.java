package com.jobscout.discovery.service;

import com.jobscout.discovery.model.KeywordStats;
import com.jobscout.discovery.model.PageOutcome;
import com.jobscout.discovery.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyword x page work items for one run. At most one page per keyword is in flight, so a keyword's
 * next page is released only once the previous page has completed; that makes end-of-results and
 * early termination exact. Safe for any number of consumers.
 */
public class KeywordWorkQueue {
    private static final Logger log = LoggerFactory.getLogger(KeywordWorkQueue.class);

    private static final class KeywordState {
        private final String keyword;
        private int nextPage = 1;
        private int pagesCompleted;
        private int jobsFound;
        private int jobsAdmitted;
        private int zeroAdmittedStreak;
        private int pageBlocks;
        private PageProgress progress;
        private boolean inFlight;
        private boolean done;
        private WorkItem pending;
        private String endReason;

        private KeywordState(String keyword) {
            this.keyword = keyword;
        }
    }

    private final Map<String, KeywordState> states = new LinkedHashMap<>();
    private final int pagesPerKeyword;
    private final int maxRetries;
    private final int zeroAdmittedThreshold;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean closed;

    public KeywordWorkQueue(List<String> keywords, int pagesPerKeyword, int maxRetries, int zeroAdmittedThreshold) {
        for (String keyword : keywords) {
            states.putIfAbsent(keyword, new KeywordState(keyword));
        }
        this.pagesPerKeyword = Math.max(1, pagesPerKeyword);
        this.maxRetries = Math.max(0, maxRetries);
        this.zeroAdmittedThreshold = Math.max(1, zeroAdmittedThreshold);
    }

    /**
     * Blocks until an item is available.
     *
     * @return the next item, or null once every keyword is finished or the queue is closed
     */
    public WorkItem take() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    return null;
                }
                boolean anyOpen = false;
                for (KeywordState state : states.values()) {
                    if (state.done) {
                        continue;
                    }
                    anyOpen = true;
                    if (state.inFlight) {
                        continue;
                    }
                    state.inFlight = true;
                    if (state.pending != null) {
                        WorkItem item = state.pending;
                        state.pending = null;
                        return item;
                    }
                    return WorkItem.first(state.keyword, state.nextPage);
                }
                if (!anyOpen) {
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void complete(WorkItem item, PageOutcome outcome) {
        lock.lock();
        try {
            KeywordState state = stateFor(item);
            state.inFlight = false;
            state.pagesCompleted++;
            state.jobsFound += outcome.candidates();
            state.jobsAdmitted += outcome.admitted();
            resetPage(state);
            if (outcome.isEmpty()) {
                finish(state, "end_of_results");
            } else {
                state.zeroAdmittedStreak = outcome.admitted() == 0 ? state.zeroAdmittedStreak + 1 : 0;
                if (state.zeroAdmittedStreak >= zeroAdmittedThreshold) {
                    finish(state, "no_admitted_jobs");
                } else {
                    advance(state);
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a transient failure of {@code item}.
     *
     * @return true when the item was queued for another attempt
     */
    public boolean fail(WorkItem item) {
        lock.lock();
        try {
            KeywordState state = stateFor(item);
            state.inFlight = false;
            boolean retry = item.attempt() < maxRetries;
            if (retry) {
                state.pending = item.nextAttempt();
            } else {
                log.warn("Giving up on '{}' page {} after {} attempts", item.keyword(), item.pageNumber(), item.attempt() + 1);
                abandonPage(state);
            }
            changed.signalAll();
            return retry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an item whose page hit a verification wall. Each block after the first uses one of
     * the page's retries, so a page that is blocked again after every recovery is eventually
     * skipped.
     *
     * @return true when the item was queued again
     */
    public boolean requeueBlocked(WorkItem item) {
        lock.lock();
        try {
            KeywordState state = stateFor(item);
            state.inFlight = false;
            state.pageBlocks++;
            boolean retry = !state.done && state.pageBlocks <= maxRetries + 1;
            if (retry) {
                state.pending = item;
            } else if (!state.done) {
                log.warn("Skipping '{}' page {} after {} verification blocks", item.keyword(), item.pageNumber(), state.pageBlocks);
                abandonPage(state);
            }
            changed.signalAll();
            return retry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an item that was not processed, without consuming a retry.
     */
    public void requeue(WorkItem item) {
        lock.lock();
        try {
            KeywordState state = stateFor(item);
            state.inFlight = false;
            if (!state.done) {
                state.pending = item;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            for (KeywordState state : states.values()) {
                if (!state.done) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keywords with at least one completed page.
     */
    public int keywordsProcessed() {
        lock.lock();
        try {
            int count = 0;
            for (KeywordState state : states.values()) {
                if (state.pagesCompleted > 0) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, String> endReasons() {
        lock.lock();
        try {
            Map<String, String> out = new LinkedHashMap<>();
            for (KeywordState state : states.values()) {
                out.put(state.keyword, state.done ? state.endReason : "unfinished");
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Progress of the page {@code item} points at, carried across attempts of that page. Only the
     * worker holding the item may touch it.
     */
    PageProgress progress(WorkItem item) {
        lock.lock();
        try {
            KeywordState state = stateFor(item);
            if (state.progress == null) {
                state.progress = new PageProgress();
            }
            return state.progress;
        } finally {
            lock.unlock();
        }
    }

    public List<KeywordStats> keywordStats() {
        lock.lock();
        try {
            List<KeywordStats> out = new ArrayList<>();
            for (KeywordState state : states.values()) {
                out.add(new KeywordStats(
                    state.keyword,
                    state.pagesCompleted,
                    state.jobsFound,
                    state.jobsAdmitted,
                    state.done ? state.endReason : "unfinished"
                ));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<String> keywords() {
        return new ArrayList<>(states.keySet());
    }

    private KeywordState stateFor(WorkItem item) {
        KeywordState state = states.get(item.keyword());
        if (state == null) {
            throw new IllegalArgumentException("Unknown keyword " + item.keyword());
        }
        return state;
    }

    private void abandonPage(KeywordState state) {
        if (state.progress != null) {
            state.jobsAdmitted += state.progress.admittedCount();
        }
        resetPage(state);
        advance(state);
    }

    private void resetPage(KeywordState state) {
        state.progress = null;
        state.pageBlocks = 0;
    }

    private void advance(KeywordState state) {
        state.nextPage++;
        if (state.nextPage > pagesPerKeyword) {
            finish(state, "page_limit");
        }
    }

    private void finish(KeywordState state, String reason) {
        state.done = true;
        state.pending = null;
        state.endReason = reason;
        log.debug("Keyword '{}' finished after {} pages: {}", state.keyword, state.pagesCompleted, reason);
    }
}
