package com.jobscout.discovery.model;

/**
 * Reference to a listing container on a rendered results page. Only meaningful to the worker that
 * rendered {@code resultsUrl}; it is never persisted.
 */
public record ListingHandle(String selector, String resultsUrl) {
}
