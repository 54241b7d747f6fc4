package com.jobscout.discovery.filter;

import com.jobscout.discovery.model.AgeBucket;
import com.jobscout.discovery.model.PostedAge;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecencyParserTest {

    private final RecencyParser parser = new RecencyParser();

    @Test
    void parsesCommonPostingAges() {
        assertEquals(new PostedAge(AgeBucket.DAYS, 3), parser.parse("3 days ago"));
        assertEquals(new PostedAge(AgeBucket.DAYS, 30), parser.parse("30+ days ago"));
        assertEquals(new PostedAge(AgeBucket.WEEKS, 2), parser.parse("Posted 2 weeks ago"));
        assertEquals(new PostedAge(AgeBucket.WEEKS, 1), parser.parse("a week ago"));
        assertEquals(new PostedAge(AgeBucket.HOURS, 5), parser.parse("5 hours ago"));
        assertEquals(new PostedAge(AgeBucket.MINUTES, 45), parser.parse("45 min ago"));
        assertEquals(new PostedAge(AgeBucket.MONTHS, 1), parser.parse("1 month ago"));
    }

    @Test
    void relativeWordsMapToHoursOrOneDay() {
        assertEquals(new PostedAge(AgeBucket.HOURS, 0), parser.parse("Today"));
        assertEquals(new PostedAge(AgeBucket.HOURS, 0), parser.parse("Just posted"));
        assertEquals(new PostedAge(AgeBucket.DAYS, 1), parser.parse("yesterday"));
    }

    @Test
    void unrecognizedTextIsUnknown() {
        assertEquals(PostedAge.UNKNOWN, parser.parse(null));
        assertEquals(PostedAge.UNKNOWN, parser.parse(""));
        assertEquals(PostedAge.UNKNOWN, parser.parse("recently"));
        assertFalse(parser.parse("Full time, permanent").isKnown());
    }

    @Test
    void postedTextDetectionNeedsMarkerAndParseableAge() {
        assertTrue(parser.looksLikePostedText("3 days ago"));
        assertTrue(parser.looksLikePostedText("Posted today"));
        assertFalse(parser.looksLikePostedText("Toronto ON"));
        assertFalse(parser.looksLikePostedText("Requires 3 years of experience"));
        assertFalse(parser.looksLikePostedText("Posted by a recruiter on behalf of a client in Toronto ON ago"));
    }
}
