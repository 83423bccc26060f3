/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.util;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell-style glob matching for NWS event names (e.g. {@code "Test*"}, {@code "* Statement"}).
 *
 * <p>
 * Supported syntax: {@code *} (any run of characters), {@code ?} (exactly one character), {@code [seq]} and
 * {@code [!seq]} character classes. Every other character matches itself. Matching is case-sensitive and covers the whole
 * event name.
 */
public final class EventGlobMatcher {

    private final List<Pattern> patterns;

    private EventGlobMatcher(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    /**
     * Compiles a blocklist of glob patterns. Null or blank entries are ignored.
     *
     * @param globs
     *            glob patterns (may be null)
     * @return matcher over the given patterns
     */
    public static EventGlobMatcher of(Collection<String> globs) {
        if (globs == null) {
            return new EventGlobMatcher(List.of());
        }
        return new EventGlobMatcher(
                globs.stream().filter(g -> g != null && !g.isBlank()).map(EventGlobMatcher::toPattern).toList());
    }

    /**
     * Returns true when the event name matches any compiled pattern.
     */
    public boolean matchesAny(String event) {
        if (event == null) {
            return false;
        }
        return patterns.stream().anyMatch(p -> p.matcher(event).matches());
    }

    /**
     * Returns true when the matcher holds no patterns.
     */
    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Translates a glob into an anchored regular expression.
     *
     * @param glob
     *            glob pattern
     * @return compiled pattern
     */
    static Pattern toPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();

        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && glob.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && glob.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        // Unclosed class, treat the bracket literally
                        regex.append("\\[");
                    } else {
                        String body = glob.substring(i, j).replace("\\", "\\\\").replace("[", "\\[");
                        i = j + 1;
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        } else if (body.startsWith("^")) {
                            body = "\\" + body;
                        }
                        regex.append('[').append(body).append(']');
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }

        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
