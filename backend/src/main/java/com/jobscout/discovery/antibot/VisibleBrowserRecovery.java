package com.jobscout.discovery.antibot;

import com.jobscout.discovery.browser.BrowserOperationException;
import com.jobscout.discovery.browser.BrowserSession;
import com.jobscout.discovery.browser.BrowserSessionFactory;
import com.jobscout.discovery.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Opens the blocked page in a headed browser carrying the worker's cookies and waits for an
 * operator to complete the challenge. One recovery window at a time across all workers.
 */
public class VisibleBrowserRecovery implements RecoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(VisibleBrowserRecovery.class);

    private final BrowserSessionFactory sessionFactory;
    private final VerificationDetector detector;
    private final Pacer pacer;
    private final Duration timeout;
    private final Duration pollInterval;
    private final ReentrantLock operatorLock = new ReentrantLock();

    public VisibleBrowserRecovery(
        BrowserSessionFactory sessionFactory,
        VerificationDetector detector,
        Pacer pacer,
        Duration timeout,
        Duration pollInterval
    ) {
        this.sessionFactory = sessionFactory;
        this.detector = detector;
        this.pacer = pacer;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    @Override
    public RecoveryResult recover(RecoveryRequest request) {
        operatorLock.lock();
        try {
            log.warn(
                "Verification required for {} at {} ({}); complete it in the opened browser within {}s",
                request.workerId(),
                request.blockedUrl(),
                request.signal(),
                timeout.toSeconds()
            );
            try (BrowserSession visible = sessionFactory.openVisible()) {
                visible.addCookies(request.cookies());
                visible.navigate(request.blockedUrl());
                Instant deadline = Instant.now().plus(timeout);
                while (Instant.now().isBefore(deadline)) {
                    if (detector.detect(visible).isEmpty()) {
                        return RecoveryResult.succeeded(visible.cookies(), "cleared in visible browser");
                    }
                    if (!pacer.pause(pollInterval)) {
                        return RecoveryResult.failed("interrupted while waiting for verification");
                    }
                }
                return RecoveryResult.failed("verification not completed within " + timeout.toSeconds() + "s");
            } catch (BrowserOperationException e) {
                log.warn("Visible browser recovery failed for {}", request.workerId(), e);
                return RecoveryResult.failed(e.getMessage());
            }
        } finally {
            operatorLock.unlock();
        }
    }
}
