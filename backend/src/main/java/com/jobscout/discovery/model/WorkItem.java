package com.jobscout.discovery.model;

public record WorkItem(String keyword, int pageNumber, int attempt) {

    public static WorkItem first(String keyword, int pageNumber) {
        return new WorkItem(keyword, pageNumber, 0);
    }

    public WorkItem nextAttempt() {
        return new WorkItem(keyword, pageNumber, attempt + 1);
    }
}
