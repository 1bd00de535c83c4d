package com.gamemind.oracle;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses free-text backend output into subgoals.
 * <p>
 * One subgoal per non-blank line. A single leading enumeration marker ({@code 1.}, {@code 12.}, {@code -},
 * {@code *}, {@code •}) is stripped; fragments shorter than {@value #MIN_LENGTH} characters are dropped;
 * at most {@link SubgoalOracle#MAX_SUBGOALS} entries are kept. Output that yields nothing parses to an
 * empty list; callers treat that as a malformed response.
 */
public final class SubgoalResponseParser {

    static final int MIN_LENGTH = 4;

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern LEADING_MARKER = Pattern.compile("^(?:\\d+\\.|[-*•])\\s*");

    public List<String> parse(String response) {
        List<String> subgoals = new ArrayList<>();
        if (response == null || response.isBlank()) return subgoals;
        for (String rawLine : LINE_BREAK.split(response.strip())) {
            String line = rawLine.strip();
            if (line.isEmpty()) continue;
            line = LEADING_MARKER.matcher(line).replaceFirst("").strip();
            if (line.length() < MIN_LENGTH) continue;
            subgoals.add(line);
            if (subgoals.size() == SubgoalOracle.MAX_SUBGOALS) break;
        }
        return subgoals;
    }
}
