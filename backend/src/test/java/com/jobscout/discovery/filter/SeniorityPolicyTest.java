package com.jobscout.discovery.filter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeniorityPolicyTest {

    @Test
    void customKeywordSetsFollowTitleThenSummaryPrecedence() {
        SeniorityPolicy policy = SeniorityPolicy.of(List.of("apprentice"), List.of("expert"));

        assertTrue(policy.admits("Apprentice Expert Analyst", null));
        assertFalse(policy.admits("Expert Analyst", "apprentice welcome"));
        assertTrue(policy.admits("Analyst", "apprentice welcome, expert mentors"));
        assertFalse(policy.admits("Analyst", "expert only"));
        assertTrue(policy.admits(null, null));
    }

    @Test
    void matchingIgnoresCase() {
        SeniorityPolicy policy = SeniorityPolicy.of(List.of(), List.of("Senior"));
        assertFalse(policy.admits("SENIOR analyst", null));
    }
}
