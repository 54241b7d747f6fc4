package com.jobscout.discovery.browser;

/**
 * The worker's browser session can no longer be used.
 */
public class WorkerFatalException extends RuntimeException {
    public WorkerFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
