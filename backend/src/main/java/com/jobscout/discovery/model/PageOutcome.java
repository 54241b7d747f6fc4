package com.jobscout.discovery.model;

public record PageOutcome(int candidates, int admitted) {

    public boolean isEmpty() {
        return candidates == 0;
    }
}
