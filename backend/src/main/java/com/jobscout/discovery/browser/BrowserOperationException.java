package com.jobscout.discovery.browser;

public class BrowserOperationException extends RuntimeException {
    public BrowserOperationException(String message) {
        super(message);
    }

    public BrowserOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
