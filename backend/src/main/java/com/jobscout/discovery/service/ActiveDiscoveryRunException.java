package com.jobscout.discovery.service;

public class ActiveDiscoveryRunException extends RuntimeException {
    public ActiveDiscoveryRunException(String message) {
        super(message);
    }
}
