package com.jobscout.discovery.model;

public enum FilterDecision {
    ADMITTED,
    TOO_OLD,
    TOO_SENIOR;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
