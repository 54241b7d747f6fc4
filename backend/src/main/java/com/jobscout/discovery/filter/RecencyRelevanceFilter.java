package com.jobscout.discovery.filter;

import com.jobscout.discovery.model.FilterDecision;
import com.jobscout.discovery.model.PostedAge;
import com.jobscout.discovery.model.ResolvedJob;
import org.springframework.stereotype.Component;

@Component
public class RecencyRelevanceFilter {

    public boolean admit(ResolvedJob job, int cutoffDays, SeniorityPolicy policy) {
        return evaluate(job, cutoffDays, policy).isAdmitted();
    }

    public FilterDecision evaluate(ResolvedJob job, int cutoffDays, SeniorityPolicy policy) {
        if (!isRecent(job.postedAge(), cutoffDays)) {
            return FilterDecision.TOO_OLD;
        }
        if (!policy.admits(job.title(), job.summary())) {
            return FilterDecision.TOO_SENIOR;
        }
        return FilterDecision.ADMITTED;
    }

    /**
     * Unknown or unparseable ages are admitted.
     */
    public boolean isRecent(PostedAge age, int cutoffDays) {
        if (age == null) {
            return true;
        }
        return switch (age.bucket()) {
            case MINUTES, HOURS, UNKNOWN -> true;
            case DAYS -> age.amount() <= cutoffDays;
            case WEEKS -> (long) age.amount() * 7 <= cutoffDays;
            case MONTHS, YEARS -> false;
        };
    }
}
