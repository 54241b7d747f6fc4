package com.jobscout.discovery.model;

public record PageSnapshot(String url, String html) {
}
