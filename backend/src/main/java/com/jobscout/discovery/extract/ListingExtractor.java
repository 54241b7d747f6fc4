package com.jobscout.discovery.extract;

import com.jobscout.discovery.filter.RecencyParser;
import com.jobscout.discovery.model.CandidateRecord;
import com.jobscout.discovery.model.ListingHandle;
import com.jobscout.discovery.model.PageSnapshot;
import com.jobscout.discovery.model.WorkItem;
import com.jobscout.discovery.site.SiteAdapter;
import com.jobscout.discovery.util.JobUrlUtils;
import com.jobscout.discovery.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a rendered search-results page into candidate records. An empty result means the site
 * has no more pages for the keyword.
 */
@Component
public class ListingExtractor {
    private static final Logger log = LoggerFactory.getLogger(ListingExtractor.class);
    private static final Pattern SALARY_PATTERN = Pattern.compile("\\$[\\d,]+(?:-\\$[\\d,]+)?");
    private static final int MAX_SUMMARY_LENGTH = 300;
    private static final int MAX_FIELD_LENGTH = 300;

    private final SiteAdapter site;
    private final RecencyParser recencyParser;

    public ListingExtractor(SiteAdapter site, RecencyParser recencyParser) {
        this.site = site;
        this.recencyParser = recencyParser;
    }

    public List<CandidateRecord> extract(PageSnapshot snapshot, WorkItem source) {
        if (snapshot == null || snapshot.html() == null || snapshot.html().isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(snapshot.html(), snapshot.url() == null ? "" : snapshot.url());

        List<Element> qualifying = new ArrayList<>();
        List<CandidateRecord> parsed = new ArrayList<>();
        int unparseable = 0;
        for (Element container : document.select(site.containerSelector())) {
            String jobLink = qualifyingJobLink(container, snapshot.url());
            if (jobLink == null) {
                continue;
            }
            CandidateRecord candidate = parse(container, jobLink, snapshot.url(), source);
            if (candidate == null) {
                unparseable++;
                continue;
            }
            qualifying.add(container);
            parsed.add(candidate);
        }

        // a container enclosing another qualifying container is a list wrapper, not a listing
        Set<Element> qualifyingSet = Collections.newSetFromMap(new IdentityHashMap<>());
        qualifyingSet.addAll(qualifying);
        Set<Element> enclosing = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Element container : qualifying) {
            for (Element ancestor : container.parents()) {
                if (qualifyingSet.contains(ancestor)) {
                    enclosing.add(ancestor);
                }
            }
        }

        List<CandidateRecord> candidates = new ArrayList<>();
        for (int i = 0; i < qualifying.size(); i++) {
            if (!enclosing.contains(qualifying.get(i))) {
                candidates.add(parsed.get(i));
            }
        }
        log.debug(
            "Extracted {} candidates from {} (containers={}, unparseable={})",
            candidates.size(),
            snapshot.url(),
            qualifying.size(),
            unparseable
        );
        return candidates;
    }

    private String qualifyingJobLink(Element container, String baseUrl) {
        String jobLink = null;
        for (Element link : container.select("a[href]")) {
            String href = absoluteHref(link, baseUrl);
            if (href == null) {
                continue;
            }
            if (site.isExcludedLink(href)) {
                return null;
            }
            if (jobLink == null && site.isJobDetailLink(href)) {
                jobLink = href;
            }
        }
        return jobLink;
    }

    private CandidateRecord parse(Element container, String listingUrl, String resultsUrl, WorkItem source) {
        List<String> lines = RenderedLines.of(container);
        if (lines.size() < 2) {
            return null;
        }

        String titleLine = lines.get(0);
        String salary = null;
        Matcher salaryMatcher = SALARY_PATTERN.matcher(titleLine);
        if (salaryMatcher.find()) {
            salary = salaryMatcher.group();
            titleLine = titleLine.replace(salary, " ");
        }
        String title = TextUtils.clean(titleLine, MAX_FIELD_LENGTH);
        String company = TextUtils.clean(stripBadge(lines.get(1)), MAX_FIELD_LENGTH);
        if (title == null || company == null) {
            return null;
        }

        String location = null;
        String postedText = null;
        List<String> rest = new ArrayList<>();
        if (lines.size() > 2) {
            String third = lines.get(2);
            if (recencyParser.looksLikePostedText(third)) {
                postedText = third;
            } else {
                location = TextUtils.clean(third, MAX_FIELD_LENGTH);
            }
            for (String line : lines.subList(3, lines.size())) {
                if (postedText == null && recencyParser.looksLikePostedText(line)) {
                    postedText = line;
                } else {
                    rest.add(line);
                }
            }
        }
        String summary = TextUtils.clean(String.join(" ", rest), MAX_SUMMARY_LENGTH);

        return new CandidateRecord(
            title,
            company,
            location,
            salary,
            postedText,
            summary,
            listingUrl,
            source == null ? null : source.keyword(),
            source == null ? 0 : source.pageNumber(),
            new ListingHandle(container.cssSelector(), resultsUrl)
        );
    }

    private String stripBadge(String companyLine) {
        String badge = site.featuredEmployerBadge();
        if (companyLine == null || badge == null || badge.isBlank()) {
            return companyLine;
        }
        String lower = companyLine.toLowerCase(Locale.ROOT);
        String badgeLower = badge.toLowerCase(Locale.ROOT);
        int index = lower.indexOf(badgeLower);
        if (index < 0) {
            return companyLine;
        }
        return companyLine.substring(0, index) + companyLine.substring(index + badge.length());
    }

    private String absoluteHref(Element link, String baseUrl) {
        String href = link.attr("href");
        if (JobUrlUtils.isPlaceholderHref(href)) {
            return null;
        }
        String absolute = link.absUrl("href");
        if (absolute != null && !absolute.isBlank()) {
            return absolute;
        }
        return JobUrlUtils.absolutize(baseUrl, href);
    }
}
