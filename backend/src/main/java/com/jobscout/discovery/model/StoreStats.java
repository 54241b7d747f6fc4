package com.jobscout.discovery.model;

import java.util.Map;

public record StoreStats(
    long total,
    long applied,
    Map<String, Long> bySite,
    Map<String, Long> byCompany,
    Map<String, Long> byAtsVendor
) {
}
