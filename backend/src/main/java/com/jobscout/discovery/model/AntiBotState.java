package com.jobscout.discovery.model;

public enum AntiBotState {
    NORMAL,
    SUSPECTED,
    VERIFYING,
    RECOVERED,
    ABANDONED
}
