package com.jobscout.discovery.site;

import java.util.List;

/**
 * Everything the pipeline needs to know about one listing site.
 */
public interface SiteAdapter {
    String name();

    String searchUrl(String keyword, int pageNumber);

    /**
     * Host suffix of the listing site. URLs on this domain never count as resolved apply URLs.
     */
    String listingDomain();

    String containerSelector();

    boolean isJobDetailLink(String absoluteHref);

    boolean isExcludedLink(String absoluteHref);

    /**
     * Badge text some listings append to the employer name.
     */
    String featuredEmployerBadge();

    List<String> roleKeywords();

    List<String> navigationKeywords();
}
