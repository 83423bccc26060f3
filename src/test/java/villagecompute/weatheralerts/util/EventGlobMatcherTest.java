/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.util;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EventGlobMatcher}.
 */
class EventGlobMatcherTest {

    @Test
    void testMatchesAny_prefixWildcard() {
        EventGlobMatcher matcher = EventGlobMatcher.of(List.of("Test*"));

        assertTrue(matcher.matchesAny("Test Message"));
        assertTrue(matcher.matchesAny("Test"));
        assertFalse(matcher.matchesAny("test message"));
        assertFalse(matcher.matchesAny("Winter Storm Warning"));
    }

    @Test
    void testMatchesAny_suffixAndSingleCharacter() {
        EventGlobMatcher matcher = EventGlobMatcher.of(List.of("* Statement", "Flood ?atch"));

        assertTrue(matcher.matchesAny("Special Weather Statement"));
        assertTrue(matcher.matchesAny("Flood Watch"));
        assertFalse(matcher.matchesAny("Flood Warning"));
    }

    @Test
    void testMatchesAny_characterClasses() {
        EventGlobMatcher matcher = EventGlobMatcher.of(List.of("[!F]lood*"));

        assertFalse(matcher.matchesAny("Flood Warning"));
        assertTrue(matcher.matchesAny("Blood Moon"));
    }

    @Test
    void testMatchesAny_regexCharactersAreLiteral() {
        EventGlobMatcher matcher = EventGlobMatcher.of(List.of("a.b", "[abc"));

        assertTrue(matcher.matchesAny("a.b"));
        assertFalse(matcher.matchesAny("axb"));
        assertTrue(matcher.matchesAny("[abc"));
    }

    @Test
    void testOf_ignoresNullAndBlank() {
        assertTrue(EventGlobMatcher.of(null).isEmpty());
        assertTrue(EventGlobMatcher.of(Arrays.asList(null, " ")).isEmpty());
        assertFalse(EventGlobMatcher.of(List.of("Test*")).matchesAny(null));
    }
}
