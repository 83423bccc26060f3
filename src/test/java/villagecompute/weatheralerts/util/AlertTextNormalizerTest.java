/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AlertTextNormalizer}.
 */
class AlertTextNormalizerTest {

    @Test
    void testNormalize_sectionHeaderAndUnits() {
        assertEquals("Detailed alert for Wind Advisory. *WHAT: Winds 25 miles per hour.",
                AlertTextNormalizer.normalize("Detailed alert for Wind Advisory. * WHAT...Winds 25 mph.", 150));
    }

    @Test
    void testNormalize_collapsesWhitespaceAndHeaders() {
        String raw = "* WHAT...Heavy snow.\n\n* WHERE...Wake County.\n\n*IMPACTS.Travel could be very difficult.";

        assertEquals("*WHAT: Heavy snow. *WHERE: Wake County. *IMPACTS: Travel could be very difficult.",
                AlertTextNormalizer.normalize(raw));
    }

    @Test
    void testNormalize_additionalDetailsHeader() {
        assertEquals("*ADDITIONAL DETAILS: Stay off the roads.",
                AlertTextNormalizer.normalize("* ADDITIONAL\nDETAILS...Stay off the roads."));
    }

    @Test
    void testNormalize_timeZonesAndEstimates() {
        assertEquals("Snow ends at 6 PM eastern standard time. estimated 4 inches of snow",
                AlertTextNormalizer.normalize("Snow ends at 6 PM EST. est. 4 in. of snow"));
    }

    @Test
    void testNormalize_ellipsisAfterAbbreviationKeepsSentenceEnd() {
        assertEquals("Snow totals estimated. 5 inches. today",
                AlertTextNormalizer.normalize("Snow totals est... 5 in... today"));
    }

    @Test
    void testNormalize_abbreviationExposedByCleanup() {
        String once = AlertTextNormalizer.normalize("Totals near 5 in .. today");

        assertEquals("Totals near 5 inches. today", once);
        assertEquals(once, AlertTextNormalizer.normalize(once));
    }

    @Test
    void testNormalize_noBreakSpaceSeparatesWords() {
        assertEquals("a b", AlertTextNormalizer.normalize("a\u00A0b\u00A0c d", 2));
        assertEquals("Gusts to 40 miles per hour", AlertTextNormalizer.normalize("Gusts\u00A0to 40\u00A0mph"));
    }

    @Test
    void testNormalize_compassAndTemperature() {
        assertEquals("Winds north 10 to 20 miles per hour with gusts of up to 40 miles per hour. Temps near 30 Fahrenheit.",
                AlertTextNormalizer.normalize("Winds N 10 to 20 mph with gusts up to 40 mph. Temps near 30 F."));
    }

    @Test
    void testNormalize_slashShorthand() {
        assertEquals("Travel with caution, detour not available",
                AlertTextNormalizer.normalize("Travel w/ caution, detour N/A"));
    }

    @Test
    void testNormalize_symbols() {
        assertEquals("Rain and snow, 50 percent chance.", AlertTextNormalizer.normalize("Rain & snow, 50% chance."));
    }

    @Test
    void testNormalize_leavesDottedAndApostropheLettersAlone() {
        assertEquals("U.S. Highway 1 and it's closed", AlertTextNormalizer.normalize("U.S. Highway 1 & it's closed"));
    }

    @Test
    void testNormalize_truncatesToMaxWords() {
        String raw = "word ".repeat(200).trim();

        String result = AlertTextNormalizer.normalize(raw, 150);

        assertEquals(150, result.split(" ").length);
    }

    @Test
    void testNormalize_shortTextNotTruncated() {
        assertEquals("one two three", AlertTextNormalizer.normalize("one two three", 3));
    }

    @Test
    void testNormalize_nullAndBlank() {
        assertEquals("", AlertTextNormalizer.normalize(null));
        assertEquals("", AlertTextNormalizer.normalize("   \n "));
    }

    @Test
    void testNormalize_rejectsNonPositiveMaxWords() {
        assertThrows(IllegalArgumentException.class, () -> AlertTextNormalizer.normalize("text", 0));
    }

    @Test
    void testNormalize_isIdempotent() {
        List<String> samples = List.of("Detailed alert for Wind Advisory. * WHAT...Winds 25 mph.",
                "Rain & snow, 50% chance. * WHERE...Wake County.",
                "Snow ends at 6 PM EST. est. 4 in. of snow, visibility below 400 m",
                "Winds NW 10 to 20 knots w/ gusts up to 35 kt. UV index high till 5 PM EDT.",
                "* WHAT...Heavy snow expected. Total snow accumulations of 4 to 6 in.\n\n* WHEN...From 6 PM this evening.");

        for (String sample : samples) {
            String once = AlertTextNormalizer.normalize(sample, 20);
            assertEquals(once, AlertTextNormalizer.normalize(once, 20), "not a fixed point: " + sample);
        }
    }
}
