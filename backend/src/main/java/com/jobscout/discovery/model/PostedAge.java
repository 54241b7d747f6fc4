package com.jobscout.discovery.model;

public record PostedAge(AgeBucket bucket, int amount) {
    public static final PostedAge UNKNOWN = new PostedAge(AgeBucket.UNKNOWN, 0);

    public PostedAge {
        bucket = bucket == null ? AgeBucket.UNKNOWN : bucket;
        amount = Math.max(0, amount);
    }

    public boolean isKnown() {
        return bucket != AgeBucket.UNKNOWN;
    }
}
