package com.jobscout.discovery.antibot;

/**
 * Clears a verification block for a suspended worker. Implementations must not return until the
 * block is cleared, has definitely failed, or their own timeout elapses.
 */
public interface RecoveryStrategy {
    RecoveryResult recover(RecoveryRequest request);
}
