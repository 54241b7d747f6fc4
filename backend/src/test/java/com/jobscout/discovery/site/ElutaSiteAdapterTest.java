package com.jobscout.discovery.site;

import com.jobscout.config.DiscoveryProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ElutaSiteAdapterTest {

    private final ElutaSiteAdapter adapter = new ElutaSiteAdapter(new DiscoveryProperties());

    @Test
    void searchUrlEncodesKeywordAndClampsPage() {
        assertEquals("https://www.eluta.ca/search?q=data+engineer&pg=2", adapter.searchUrl(" data engineer ", 2));
        assertEquals("https://www.eluta.ca/search?q=qa&pg=1", adapter.searchUrl("qa", 0));
    }

    @Test
    void trailingSlashOnBaseUrlIsIgnored() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getSite().setBaseUrl("https://www.eluta.ca/");
        ElutaSiteAdapter slashed = new ElutaSiteAdapter(properties);

        assertEquals("https://www.eluta.ca/search?q=java&pg=3", slashed.searchUrl("java", 3));
    }

    @Test
    void jobDetailLinksMustStayOnListingDomain() {
        assertTrue(adapter.isJobDetailLink("https://www.eluta.ca/job/abc123"));
        assertFalse(adapter.isJobDetailLink("https://elsewhere.com/job/abc123"));
        assertFalse(adapter.isJobDetailLink("https://www.eluta.ca/search?q=x"));
        assertFalse(adapter.isJobDetailLink(null));
    }

    @Test
    void employerMarketingLinksAreExcluded() {
        assertTrue(adapter.isExcludedLink("https://www.canadastop100.com/acme"));
        assertTrue(adapter.isExcludedLink("https://www.eluta.ca/Employer-Review/acme"));
        assertFalse(adapter.isExcludedLink("https://boards.greenhouse.io/acme/jobs/1"));
        assertFalse(adapter.isExcludedLink(""));
    }
}
