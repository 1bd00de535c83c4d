package com.gamemind.oracle;

import java.util.List;
import java.util.Locale;

/**
 * Derives {@link TaskAnalysis} fields from a free-text rationale.
 * Steps are the number of distinct action verbs (collect, craft, place, defeat, find, move, use)
 * present in the rationale, clamped to [{@value TaskAnalysis#MIN_STEPS}, {@value TaskAnalysis#MAX_STEPS}].
 */
public final class TaskAnalyzer {

    static final List<String> ACTION_VOCABULARY =
            List.of("collect", "craft", "place", "defeat", "find", "move", "use");

    private TaskAnalyzer() {
    }

    public static TaskAnalysis analyze(String task, String rationale) {
        return new TaskAnalysis(task, rationale, estimateComplexity(rationale), estimateSteps(rationale));
    }

    public static Complexity estimateComplexity(String rationale) {
        return Complexity.fromWordCount(wordCount(rationale));
    }

    public static int estimateSteps(String rationale) {
        String text = rationale != null ? rationale.toLowerCase(Locale.ROOT) : "";
        int count = 0;
        for (String word : ACTION_VOCABULARY) {
            if (text.contains(word)) {
                count++;
            }
        }
        return Math.max(TaskAnalysis.MIN_STEPS, Math.min(count, TaskAnalysis.MAX_STEPS));
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().split("\\s+").length;
    }
}
