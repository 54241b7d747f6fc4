package com.jobscout.discovery.antibot;

import com.jobscout.discovery.browser.BrowserCookie;
import com.jobscout.discovery.model.AntiBotState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-worker verification state. Not thread-safe; owned by the worker that created it.
 */
public class AntiBotStateMachine {
    private static final Logger log = LoggerFactory.getLogger(AntiBotStateMachine.class);
    private static final Map<AntiBotState, Set<AntiBotState>> TRANSITIONS = new EnumMap<>(AntiBotState.class);

    static {
        TRANSITIONS.put(AntiBotState.NORMAL, EnumSet.of(AntiBotState.SUSPECTED));
        TRANSITIONS.put(AntiBotState.SUSPECTED, EnumSet.of(AntiBotState.VERIFYING));
        TRANSITIONS.put(AntiBotState.VERIFYING, EnumSet.of(AntiBotState.RECOVERED, AntiBotState.ABANDONED));
        TRANSITIONS.put(AntiBotState.RECOVERED, EnumSet.of(AntiBotState.NORMAL));
        TRANSITIONS.put(AntiBotState.ABANDONED, EnumSet.noneOf(AntiBotState.class));
    }

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String workerId, AntiBotState from, AntiBotState to, String detail);
    }

    private final String workerId;
    private final RecoveryStrategy strategy;
    private final int maxRecoveryAttempts;
    private final TransitionListener listener;

    private AntiBotState state = AntiBotState.NORMAL;
    private int suspectedCount;
    private int recoveredCount;

    public AntiBotStateMachine(
        String workerId,
        RecoveryStrategy strategy,
        int maxRecoveryAttempts,
        TransitionListener listener
    ) {
        this.workerId = workerId;
        this.strategy = strategy;
        this.maxRecoveryAttempts = Math.max(1, maxRecoveryAttempts);
        this.listener = listener;
    }

    public AntiBotState state() {
        return state;
    }

    public boolean isSuspended() {
        return state == AntiBotState.SUSPECTED || state == AntiBotState.VERIFYING;
    }

    public int suspectedCount() {
        return suspectedCount;
    }

    public int recoveredCount() {
        return recoveredCount;
    }

    /**
     * Runs recovery for a detected block. On success the machine is left in
     * {@link AntiBotState#RECOVERED} and the caller installs the returned cookies before calling
     * {@link #resume()}. After {@code maxRecoveryAttempts} failures the machine is
     * {@link AntiBotState#ABANDONED}.
     */
    public RecoveryResult handle(VerificationRequiredException block, List<BrowserCookie> cookies) {
        transition(AntiBotState.SUSPECTED, block.getSignal());
        suspectedCount++;
        transition(AntiBotState.VERIFYING, block.getBlockedUrl());

        for (int attempt = 1; attempt <= maxRecoveryAttempts; attempt++) {
            RecoveryResult result = attemptRecovery(block, cookies, attempt);
            if (result.recovered()) {
                recoveredCount++;
                transition(AntiBotState.RECOVERED, result.detail());
                return result;
            }
            log.warn(
                "Recovery attempt {}/{} failed for {}: {}",
                attempt,
                maxRecoveryAttempts,
                workerId,
                result.detail()
            );
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        transition(AntiBotState.ABANDONED, "recovery attempts exhausted");
        return RecoveryResult.failed("abandoned after " + maxRecoveryAttempts + " attempts");
    }

    public void resume() {
        transition(AntiBotState.NORMAL, "resumed");
    }

    private RecoveryResult attemptRecovery(VerificationRequiredException block, List<BrowserCookie> cookies, int attempt) {
        RecoveryRequest request = new RecoveryRequest(
            workerId,
            block.getBlockedUrl(),
            block.getSignal(),
            cookies == null ? List.of() : cookies,
            attempt
        );
        try {
            RecoveryResult result = strategy.recover(request);
            return result == null ? RecoveryResult.failed("no result") : result;
        } catch (RuntimeException e) {
            log.warn("Recovery strategy threw for {} at {}", workerId, block.getBlockedUrl(), e);
            return RecoveryResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void transition(AntiBotState next, String detail) {
        AntiBotState previous = state;
        if (!TRANSITIONS.get(previous).contains(next)) {
            throw new IllegalStateException("Illegal anti-bot transition " + previous + " -> " + next);
        }
        state = next;
        if (listener != null) {
            listener.onTransition(workerId, previous, next, detail);
        }
    }
}
