package com.jobscout.discovery.model;

public enum AgeBucket {
    MINUTES,
    HOURS,
    DAYS,
    WEEKS,
    MONTHS,
    YEARS,
    UNKNOWN
}
