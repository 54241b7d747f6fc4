package com.jobscout.discovery.model;

public enum InsertResult {
    INSERTED,
    ALREADY_PRESENT
}
