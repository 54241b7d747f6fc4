package com.jobscout.discovery.filter;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.AtsVendor;
import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.PostedAge;
import com.jobscout.discovery.model.ResolvedJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecencyRelevanceFilterTest {

    private final RecencyRelevanceFilter filter = new RecencyRelevanceFilter();
    private final RecencyParser parser = new RecencyParser();
    private final SeniorityPolicy policy = SeniorityPolicy.from(new DiscoveryProperties.Filter());

    @Test
    void cutoffIsInclusiveForDaysAndWeeks() {
        assertTrue(filter.isRecent(parser.parse("14 days ago"), 14));
        assertFalse(filter.isRecent(parser.parse("15 days ago"), 14));
        assertTrue(filter.isRecent(parser.parse("2 weeks ago"), 14));
        assertFalse(filter.isRecent(parser.parse("3 weeks ago"), 14));
    }

    @Test
    void hoursAndUnknownAgesAreRecentMonthsAreNot() {
        assertTrue(filter.isRecent(new PostedAge(AgeBucket.HOURS, 20), 14));
        assertTrue(filter.isRecent(PostedAge.UNKNOWN, 14));
        assertTrue(filter.isRecent(null, 14));
        assertFalse(filter.isRecent(new PostedAge(AgeBucket.MONTHS, 1), 14));
        assertFalse(filter.isRecent(new PostedAge(AgeBucket.YEARS, 1), 365));
    }

    @Test
    void entryLevelTitleWinsOverSeniorSummary() {
        ResolvedJob job = job("Junior Data Analyst", "Candidates with 5+ years preferred", "2 days ago");
        assertEquals(FilterDecision.ADMITTED, filter.evaluate(job, 14, policy));
    }

    @Test
    void seniorTitleIsRejected() {
        ResolvedJob job = job("Senior Data Analyst", "Entry level friendly team", "2 days ago");
        assertEquals(FilterDecision.TOO_SENIOR, filter.evaluate(job, 14, policy));
    }

    @Test
    void summaryDecidesWhenTitleIsNeutral() {
        assertTrue(filter.admit(job("Data Analyst", "Great for a new grad", "today"), 14, policy));
        assertFalse(filter.admit(job("Data Analyst", "Requires 5+ years in SQL", "today"), 14, policy));
        assertTrue(filter.admit(job("Data Analyst", "Work with SQL dashboards", "today"), 14, policy));
    }

    @Test
    void keywordsMatchOnWordBoundariesOnly() {
        assertTrue(filter.admit(job("Leading Analytics Analyst", null, null), 14, policy));
        assertFalse(filter.admit(job("Team Lead, Data", null, null), 14, policy));
    }

    @Test
    void recencyIsCheckedBeforeSeniority() {
        ResolvedJob job = job("Senior Data Analyst", null, "3 weeks ago");
        assertEquals(FilterDecision.TOO_OLD, filter.evaluate(job, 14, policy));
    }

    private ResolvedJob job(String title, String summary, String posted) {
        return new ResolvedJob(
            title,
            "Acme",
            "Toronto ON",
            summary,
            null,
            "https://jobs.example.com/1",
            "https://www.eluta.ca/job/1",
            AtsVendor.UNKNOWN,
            true,
            posted,
            parser.parse(posted),
            "eluta",
            "data analyst",
            1,
            "fp",
            Instant.now()
        );
    }
}
