package com.jobscout.discovery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobUrlUtilsTest {

    @Test
    void placeholderHrefsAreRecognized() {
        assertTrue(JobUrlUtils.isPlaceholderHref("#"));
        assertTrue(JobUrlUtils.isPlaceholderHref("javascript:void(0)"));
        assertTrue(JobUrlUtils.isPlaceholderHref(" "));
        assertFalse(JobUrlUtils.isPlaceholderHref("/job/1"));
    }

    @Test
    void relativeHrefsResolveAgainstBase() {
        assertEquals(
            "https://www.eluta.ca/job/abc",
            JobUrlUtils.absolutize("https://www.eluta.ca/search?q=x&pg=1", "/job/abc")
        );
        assertEquals("https://other.com/x", JobUrlUtils.absolutize("https://www.eluta.ca/", "https://other.com/x"));
        assertNull(JobUrlUtils.absolutize("https://www.eluta.ca/", "#"));
    }

    @Test
    void domainMatchIncludesSubdomains() {
        assertTrue(JobUrlUtils.isOnDomain("https://www.eluta.ca/job/1", "eluta.ca"));
        assertTrue(JobUrlUtils.isOnDomain("https://eluta.ca/", "eluta.ca"));
        assertFalse(JobUrlUtils.isOnDomain("https://noteluta.ca/", "eluta.ca"));
        assertFalse(JobUrlUtils.isOnDomain("not a url", "eluta.ca"));
    }

    @Test
    void fingerprintNormalizationDropsTrackingAndDefaultPort() {
        assertEquals(
            "https://jobs.acme.com/careers/1?id=7",
            JobUrlUtils.normalizeForFingerprint("HTTPS://Jobs.Acme.com:443/careers/1/?utm_medium=x&id=7&gclid=abc#top")
        );
        assertEquals("", JobUrlUtils.normalizeForFingerprint(null));
    }
}
