package com.jobscout.discovery.filter;

import com.jobscout.config.DiscoveryProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Entry-level and senior keyword sets with a fixed precedence: title entry-level, title senior,
 * summary entry-level, summary senior, otherwise admit.
 */
public final class SeniorityPolicy {
    private final List<Pattern> entryLevel;
    private final List<Pattern> senior;

    private SeniorityPolicy(List<Pattern> entryLevel, List<Pattern> senior) {
        this.entryLevel = entryLevel;
        this.senior = senior;
    }

    public static SeniorityPolicy of(List<String> entryLevelKeywords, List<String> seniorKeywords) {
        return new SeniorityPolicy(compile(entryLevelKeywords), compile(seniorKeywords));
    }

    public static SeniorityPolicy from(DiscoveryProperties.Filter filter) {
        return of(filter.getEntryLevelKeywords(), filter.getSeniorKeywords());
    }

    public boolean admits(String title, String summary) {
        if (matchesAny(entryLevel, title)) {
            return true;
        }
        if (matchesAny(senior, title)) {
            return false;
        }
        if (matchesAny(entryLevel, summary)) {
            return true;
        }
        return !matchesAny(senior, summary);
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> keywords) {
        List<Pattern> out = new ArrayList<>();
        if (keywords == null) {
            return out;
        }
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            out.add(Pattern.compile(
                "(?<![\\p{Alnum}])" + Pattern.quote(normalized) + "(?![\\p{Alnum}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            ));
        }
        return out;
    }
}
