package com.jobscout.discovery.filter;

import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.PostedAge;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text posting ages such as "3 days ago", "2 weeks ago", "30+ days ago" or "today".
 */
@Component
public class RecencyParser {
    private static final Pattern AGE_PATTERN = Pattern.compile(
        "\\b(\\d{1,4}|an?|one)\\s*\\+?\\s*(minute|min|hour|hr|day|week|month|year)s?\\b",
        Pattern.CASE_INSENSITIVE
    );

    public PostedAge parse(String text) {
        if (text == null || text.isBlank()) {
            return PostedAge.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("just posted") || lower.contains("just now") || lower.contains("today")) {
            return new PostedAge(AgeBucket.HOURS, 0);
        }
        if (lower.contains("yesterday")) {
            return new PostedAge(AgeBucket.DAYS, 1);
        }
        Matcher matcher = AGE_PATTERN.matcher(lower);
        if (!matcher.find()) {
            return PostedAge.UNKNOWN;
        }
        int amount = parseAmount(matcher.group(1));
        return new PostedAge(bucketFor(matcher.group(2)), amount);
    }

    /**
     * True for a line that carries nothing but posting-age information.
     */
    public boolean looksLikePostedText(String line) {
        if (line == null || line.isBlank() || line.length() > 60) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        boolean marker = lower.contains("ago")
            || lower.contains("posted")
            || lower.contains("today")
            || lower.contains("yesterday");
        return marker && parse(line).isKnown();
    }

    private int parseAmount(String raw) {
        if (raw == null) {
            return 0;
        }
        if (raw.equals("a") || raw.equals("an") || raw.equals("one")) {
            return 1;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private AgeBucket bucketFor(String unit) {
        return switch (unit) {
            case "minute", "min" -> AgeBucket.MINUTES;
            case "hour", "hr" -> AgeBucket.HOURS;
            case "day" -> AgeBucket.DAYS;
            case "week" -> AgeBucket.WEEKS;
            case "month" -> AgeBucket.MONTHS;
            case "year" -> AgeBucket.YEARS;
            default -> AgeBucket.UNKNOWN;
        };
    }
}
