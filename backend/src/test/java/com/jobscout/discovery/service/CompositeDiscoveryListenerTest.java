package com.jobscout.discovery.service;

import com.jobscout.discovery.model.DiscoveryStats;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompositeDiscoveryListenerTest {

    @Test
    void failingListenerDoesNotStarveOthers() {
        List<String> seen = new ArrayList<>();
        DiscoveryListener broken = new DiscoveryListener() {
            @Override
            public void onRunCompleted(DiscoveryStats stats) {
                throw new IllegalStateException("boom");
            }
        };
        DiscoveryListener recording = new DiscoveryListener() {
            @Override
            public void onRunCompleted(DiscoveryStats stats) {
                seen.add("completed");
            }
        };

        new CompositeDiscoveryListener(List.of(broken, recording)).onRunCompleted(DiscoveryStats.empty(Instant.now()));

        assertEquals(List.of("completed"), seen);
    }
}
