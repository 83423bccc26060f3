/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites raw NWS alert descriptions into a clean, bounded-length message suitable for chat delivery and text-to-speech
 * relays.
 *
 * <p>
 * Normalization runs in a fixed order:
 * <ol>
 * <li>Whitespace collapse (newlines and runs of blanks become a single space)</li>
 * <li>Section headers such as {@code *WHAT.} or {@code * WHAT...} become {@code *WHAT: }</li>
 * <li>Abbreviation expansion from an ordered rewrite table</li>
 * <li>Punctuation cleanup (repeated dots, dot after a colon, double spaces)</li>
 * <li>Steps 3 and 4 again while cleanup keeps exposing new matches</li>
 * <li>Truncation to the first {@code maxWords} tokens</li>
 * </ol>
 *
 * <p>
 * The rewrite table is a list, not a map: each rule is a single pass over the string produced by the rules before it,
 * so overlapping rules resolve deterministically. Slash and dotted shorthand ({@code w/}, {@code N/A}, {@code e.g.})
 * runs before the single-letter compass and temperature rules, and single letters only match when they stand alone
 * (not inside {@code U.S.} or {@code it's}).
 *
 * <p>
 * Output of {@link #normalize(String, int)} is a fixed point: normalizing it again returns the same string.
 *
 * <h3>Usage Examples:</h3>
 *
 * <pre>
 * String message = AlertTextNormalizer.normalize("Detailed alert for Wind Advisory. * WHAT...Winds 25 mph.", 150);
 * // "Detailed alert for Wind Advisory. *WHAT: Winds 25 miles per hour."
 * </pre>
 */
public final class AlertTextNormalizer {

    /** Default word limit for outbound messages. */
    public static final int DEFAULT_MAX_WORDS = 150;

    // Unicode-aware so a no-break space separates words like any other blank
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern SECTION_HEADER = Pattern
            .compile("\\*\\s*(WHAT|WHERE|WHEN|IMPACTS|ADDITIONAL\\s+DETAILS)\\.+\\s*", Pattern.CASE_INSENSITIVE);

    private static final Pattern REPEATED_DOTS = Pattern.compile("\\s*\\.\\.+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern COLON_DOT = Pattern.compile(":\\s*\\.", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern MULTI_SPACE = Pattern.compile("\\s{2,}", Pattern.UNICODE_CHARACTER_CLASS);

    /** Upper bound on rewrite-and-cleanup passes. Real alert text settles after one or two. */
    private static final int MAX_PASSES = 4;

    /**
     * Ordered rewrite table. Order matters where rules overlap.
     */
    private static final List<Rewrite> REWRITES = List.of(
            // Slash and dotted shorthand before any single-letter rule can split it
            rewrite("\\bc/o\\b", "care of"), rewrite("\\bb/w\\b", "between"), rewrite("\\bN/A\\b", "not available"),
            rewrite("\\bw/", "with"), rewrite("\\be\\.g\\.", "for example"), rewrite("\\bi\\.e\\.", "that is"),

            // Time zones are only ever upper case in NWS products; matching them case-sensitively keeps
            // "est." (estimated) and ordinary words like "est" out of the way
            timeZone("AKST", "alaska standard time"), timeZone("AKDT", "alaska daylight time"),
            timeZone("HST", "hawaii standard time"), timeZone("HDT", "hawaii daylight time"),
            timeZone("EDT", "eastern daylight time"), timeZone("EST", "eastern standard time"),
            timeZone("CST", "central standard time"), timeZone("CDT", "central daylight time"),
            timeZone("MST", "mountain standard time"), timeZone("MDT", "mountain daylight time"),
            timeZone("PST", "pacific standard time"), timeZone("PDT", "pacific daylight time"),
            rewrite("\\best\\.", "estimated"),

            rewrite("\\bgusts up to\\b", "gusts of up to"),

            // Units
            rewrite("\\bmph\\b", "miles per hour"), rewrite("\\bknots\\b", "nautical miles per hour"),
            rewrite("\\bnm\\b", "nautical miles"), rewrite("\\bft\\.", "feet"), rewrite("(?<=\\d ?)in\\.", "inches"),
            rewrite("\\bkm\\b", "kilometer"), rewrite("\\bmi\\b", "mile"), rewrite("(?<=\\d ?)m\\b", "meter"),
            rewrite("\\bhrs\\b", "hours"), rewrite("\\bhr\\b", "hour"), rewrite("\\bmin\\b", "minute"),
            rewrite("\\bsec\\b", "second"), rewrite("\\bsq\\b", "square"),

            // Symbols
            rewrite("%", " percent"), rewrite("&", " and "), rewrite("\\+", " plus "), rewrite("\\.\\.\\.", "."),

            // General shorthand
            rewrite("\\bblw\\b", "below"), rewrite("\\babv\\b", "above"), rewrite("\\bavg\\b", "average"),
            rewrite("\\bfr\\b", "from"), rewrite("\\btill\\b", "until"), rewrite("\\bbtwn\\b", "between"),
            rewrite("\\bUV\\b", "ultraviolet"),

            // Compass points, two-letter forms first
            standalone("NE", "northeast"), standalone("NW", "northwest"), standalone("SE", "southeast"),
            standalone("SW", "southwest"), standalone("N", "north"), standalone("S", "south"),
            standalone("E", "east"), standalone("W", "west"),

            // Temperature units
            standalone("F", "Fahrenheit"), standalone("C", "Celsius"));

    private AlertTextNormalizer() {
        // Utility class, no instantiation
    }

    /**
     * Normalizes alert text using {@link #DEFAULT_MAX_WORDS}.
     *
     * @param text
     *            raw alert text (null treated as empty)
     * @return normalized text
     */
    public static String normalize(String text) {
        return normalize(text, DEFAULT_MAX_WORDS);
    }

    /**
     * Normalizes alert text and truncates it to {@code maxWords} space-separated tokens.
     *
     * @param text
     *            raw alert text (null treated as empty)
     * @param maxWords
     *            maximum number of tokens to keep (must be positive)
     * @return normalized text; unchanged in token count when it already has {@code maxWords} tokens or fewer
     * @throws IllegalArgumentException
     *             if {@code maxWords} is less than 1
     */
    public static String normalize(String text, int maxWords) {
        if (maxWords < 1) {
            throw new IllegalArgumentException("maxWords must be positive, got " + maxWords);
        }
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = WHITESPACE.matcher(text).replaceAll(" ").trim();
        result = SECTION_HEADER.matcher(result).replaceAll("*$1: ");

        // Cleanup can expose a new match ("5 in .." becomes "5 in."), so repeat until the text settles
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = cleanup(applyRewrites(result));
            if (next.equals(result)) {
                break;
            }
            result = next;
        }

        return truncate(result, maxWords);
    }

    private static String applyRewrites(String text) {
        String result = text;
        for (Rewrite rewrite : REWRITES) {
            result = rewrite.apply(result);
        }
        return result;
    }

    private static String cleanup(String text) {
        String result = REPEATED_DOTS.matcher(text).replaceAll(".");
        result = COLON_DOT.matcher(result).replaceAll(":");
        return MULTI_SPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Keeps the first {@code maxWords} tokens. Punctuation is not re-balanced.
     */
    static String truncate(String text, int maxWords) {
        String[] words = text.split(" ");
        if (words.length <= maxWords) {
            return text;
        }
        return String.join(" ", List.of(words).subList(0, maxWords));
    }

    private static Rewrite rewrite(String regex, String replacement) {
        return new Rewrite(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    private static Rewrite timeZone(String abbreviation, String replacement) {
        return new Rewrite(Pattern.compile("\\b" + abbreviation + "\\b"), replacement);
    }

    /**
     * Single letters and compass pairs only match as standalone tokens: not next to a word character, an apostrophe,
     * or (on the left) a dot, so "U.S." and "it's" are left alone.
     */
    private static Rewrite standalone(String token, String replacement) {
        return new Rewrite(Pattern.compile("(?<![\\w'\u2019.])" + token + "(?![\\w'\u2019])", Pattern.CASE_INSENSITIVE),
                replacement);
    }

    private record Rewrite(Pattern pattern, String replacement) {

        String apply(String text) {
            return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
        }
    }
}
