package com.airbrief.content.summary;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryParserTest {
    @Test
    void readsHeadlineAndDescriptionLines() {
        LocationSummary summary = SummaryParser.parse("""
                Headline: Sneezy Skies
                Description: Breathing feels easy, but pollen may make your lungs feel scratchy.
                """, 200).orElseThrow();

        assertEquals("Sneezy Skies", summary.headline());
        assertEquals("Breathing feels easy, but pollen may make your lungs feel scratchy.", summary.description());
    }

    @Test
    void labelsAreCaseInsensitiveAndQuotesAreDropped() {
        LocationSummary summary = SummaryParser.parse(
                "Sure!\nHEADLINE: \"Fresh Breeze\"\ndescription:   Perfect air for a jog.  ", 200).orElseThrow();

        assertEquals("Fresh Breeze", summary.headline());
        assertEquals("Perfect air for a jog.", summary.description());
    }

    @Test
    void missingFieldTakesItsDefault() {
        LocationSummary summary = SummaryParser.parse("Headline: Stormy Tingles", 200).orElseThrow();

        assertEquals("Stormy Tingles", summary.headline());
        assertEquals(LocationSummary.DEFAULT_DESCRIPTION, summary.description());
    }

    @Test
    void replyWithoutEitherLabelIsUnusable() {
        assertEquals(Optional.empty(), SummaryParser.parse("The air is nice today.", 200));
        assertTrue(SummaryParser.parse("   ", 200).isEmpty());
        assertTrue(SummaryParser.parse(null, 200).isEmpty());
    }

    @Test
    void longDescriptionIsTruncatedWithEllipsis() {
        LocationSummary summary = SummaryParser.parse("Headline: Long\nDescription: " + "a".repeat(300), 200).orElseThrow();

        assertEquals(200, summary.description().length());
        assertTrue(summary.description().endsWith("..."));
    }
}
