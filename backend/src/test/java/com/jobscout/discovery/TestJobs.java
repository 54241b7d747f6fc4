package com.jobscout.discovery;

import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.AtsVendor;
import com.jobscout.discovery.model.PostedAge;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.util.JobFingerprint;

import java.time.Instant;

public final class TestJobs {
    private TestJobs() {
    }

    public static ResolvedJob job(String title, String company, String applyUrl) {
        return job(title, company, applyUrl, AtsVendor.UNKNOWN);
    }

    public static ResolvedJob job(String title, String company, String applyUrl, AtsVendor vendor) {
        return new ResolvedJob(
            title,
            company,
            "Toronto ON",
            "Build dashboards in SQL.",
            "$60,000",
            applyUrl,
            "https://www.eluta.ca/job/" + Math.abs(applyUrl.hashCode()),
            vendor,
            true,
            "2 days ago",
            new PostedAge(AgeBucket.DAYS, 2),
            "eluta",
            "data analyst",
            1,
            JobFingerprint.of(title, company, applyUrl),
            Instant.now()
        );
    }
}
