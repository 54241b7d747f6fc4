package com.jobscout.discovery.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized and fixed waits between browser actions. Returns early, with the interrupt flag
 * restored, when the waiting thread is interrupted.
 */
public class Pacer {
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final Sleeper sleeper;

    public Pacer(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public static Pacer noDelay() {
        return new Pacer(duration -> { });
    }

    public boolean pauseBetween(int minMs, int maxMs) {
        int low = Math.max(0, minMs);
        int high = Math.max(low, maxMs);
        long millis = low == high ? low : ThreadLocalRandom.current().nextLong(low, high + 1L);
        return pause(Duration.ofMillis(millis));
    }

    /**
     * @return false when interrupted
     */
    public boolean pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
