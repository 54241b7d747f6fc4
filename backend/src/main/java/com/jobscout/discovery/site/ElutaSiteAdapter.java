package com.jobscout.discovery.site;

import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.util.JobUrlUtils;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

@Component
public class ElutaSiteAdapter implements SiteAdapter {
    private final DiscoveryProperties.Site site;
    private final DiscoveryProperties.Resolver resolver;

    public ElutaSiteAdapter(DiscoveryProperties properties) {
        this.site = properties.getSite();
        this.resolver = properties.getResolver();
    }

    @Override
    public String name() {
        return site.getName();
    }

    @Override
    public String searchUrl(String keyword, int pageNumber) {
        String base = site.getBaseUrl().endsWith("/")
            ? site.getBaseUrl().substring(0, site.getBaseUrl().length() - 1)
            : site.getBaseUrl();
        String query = URLEncoder.encode(keyword.trim(), StandardCharsets.UTF_8);
        return base + "/search?q=" + query + "&pg=" + Math.max(1, pageNumber);
    }

    @Override
    public String listingDomain() {
        return site.getListingDomain();
    }

    @Override
    public String containerSelector() {
        return site.getContainerSelector();
    }

    @Override
    public boolean isJobDetailLink(String absoluteHref) {
        if (absoluteHref == null || absoluteHref.isBlank()) {
            return false;
        }
        String lower = absoluteHref.toLowerCase(Locale.ROOT);
        return lower.contains(site.getJobDetailPathMarker().toLowerCase(Locale.ROOT))
            && JobUrlUtils.isOnDomain(absoluteHref, site.getListingDomain());
    }

    @Override
    public boolean isExcludedLink(String absoluteHref) {
        if (absoluteHref == null || absoluteHref.isBlank()) {
            return false;
        }
        String lower = absoluteHref.toLowerCase(Locale.ROOT);
        for (String pattern : site.getExcludedLinkPatterns()) {
            if (pattern != null && !pattern.isBlank() && lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String featuredEmployerBadge() {
        return site.getFeaturedEmployerBadge();
    }

    @Override
    public List<String> roleKeywords() {
        return resolver.getRoleKeywords();
    }

    @Override
    public List<String> navigationKeywords() {
        return resolver.getNavigationKeywords();
    }
}
