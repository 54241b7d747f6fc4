package com.jobscout.discovery.antibot;

public class VerificationRequiredException extends RuntimeException {
    private final String blockedUrl;
    private final String signal;

    public VerificationRequiredException(String blockedUrl, String signal) {
        super("Verification required at " + blockedUrl + " (" + signal + ")");
        this.blockedUrl = blockedUrl;
        this.signal = signal;
    }

    public String getBlockedUrl() {
        return blockedUrl;
    }

    public String getSignal() {
        return signal;
    }
}
