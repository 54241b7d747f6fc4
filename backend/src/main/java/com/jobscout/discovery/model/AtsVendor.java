package com.jobscout.discovery.model;

public enum AtsVendor {
    WORKDAY,
    GREENHOUSE,
    LEVER,
    ICIMS,
    BAMBOOHR,
    SMARTRECRUITERS,
    JOBVITE,
    TALEO,
    SUCCESSFACTORS,
    UNKNOWN
}
