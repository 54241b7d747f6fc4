package com.jobscout.discovery.antibot;

import com.jobscout.discovery.browser.BrowserOperationException;
import com.jobscout.discovery.browser.BrowserSession;
import com.jobscout.discovery.browser.BrowserSessionFactory;
import com.jobscout.discovery.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Waits out a timed block with escalating pauses, then probes the blocked page in a fresh headless
 * session.
 */
public class CooldownRecovery implements RecoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(CooldownRecovery.class);
    private static final Duration DEFAULT_STEP = Duration.ofMinutes(1);

    private final BrowserSessionFactory sessionFactory;
    private final VerificationDetector detector;
    private final Pacer pacer;
    private final List<Duration> backoffSteps;

    public CooldownRecovery(
        BrowserSessionFactory sessionFactory,
        VerificationDetector detector,
        Pacer pacer,
        List<Duration> backoffSteps
    ) {
        this.sessionFactory = sessionFactory;
        this.detector = detector;
        this.pacer = pacer;
        this.backoffSteps = backoffSteps == null ? List.of() : List.copyOf(backoffSteps);
    }

    @Override
    public RecoveryResult recover(RecoveryRequest request) {
        Duration wait = backoffFor(request.attempt());
        log.info(
            "Cooling down {} for {}s before re-probing {} (attempt {})",
            request.workerId(),
            wait.toSeconds(),
            request.blockedUrl(),
            request.attempt()
        );
        if (!pacer.pause(wait)) {
            return RecoveryResult.failed("interrupted during cooldown");
        }
        try (BrowserSession probe = sessionFactory.open()) {
            probe.addCookies(request.cookies());
            probe.navigate(request.blockedUrl());
            Optional<String> signal = detector.detect(probe);
            if (signal.isPresent()) {
                return RecoveryResult.failed("still blocked: " + signal.get());
            }
            return RecoveryResult.succeeded(probe.cookies(), "block cleared after " + wait.toSeconds() + "s");
        } catch (BrowserOperationException e) {
            log.warn("Cooldown probe failed for {}", request.workerId(), e);
            return RecoveryResult.failed(e.getMessage());
        }
    }

    Duration backoffFor(int attempt) {
        if (backoffSteps.isEmpty()) {
            return DEFAULT_STEP;
        }
        int index = Math.max(0, Math.min(attempt, backoffSteps.size()) - 1);
        return backoffSteps.get(index);
    }
}
