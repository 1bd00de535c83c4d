package com.gamemind.oracle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic, rule-based oracle. Needs no backend and is safe for concurrent use (immutable).
 * <p>
 * A goal is matched case-insensitively against the rule keys in insertion order; the first key contained
 * in the goal selects its subgoals. Goals matching no key get {@link #DEFAULT_SUBGOALS}.
 */
public final class FallbackOracle implements SubgoalOracle {

    public static final List<String> DEFAULT_SUBGOALS =
            List.of("explore environment", "gather resources", "avoid danger", "complete objective");

    static final String BASIC_RATIONALE = "Basic task analysis";
    static final int BASIC_STEPS = 3;

    private final Map<String, List<String>> rules;
    private final List<String> defaultSubgoals;

    /** Oracle over the built-in survival/crafting rule table. */
    public FallbackOracle() {
        this(defaultRules(), DEFAULT_SUBGOALS);
    }

    /**
     * @param rules           goal key to subgoals; iteration order is match priority
     * @param defaultSubgoals subgoals for goals matching no key
     */
    public FallbackOracle(Map<String, List<String>> rules, List<String> defaultSubgoals) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : rules.entrySet()) {
            copy.put(e.getKey().toLowerCase(Locale.ROOT), checkedSubgoals(e.getKey(), e.getValue()));
        }
        this.rules = copy;
        this.defaultSubgoals = checkedSubgoals("<default>", defaultSubgoals);
    }

    /** The built-in rule table, in match order. */
    public static Map<String, List<String>> defaultRules() {
        Map<String, List<String>> rules = new LinkedHashMap<>();
        rules.put("survive", List.of("find food", "find shelter", "avoid enemies", "maintain health"));
        rules.put("collect wood", List.of("find trees", "chop wood", "gather resources", "return to base"));
        rules.put("make wood_pickaxe", List.of("collect wood", "find workbench", "craft pickaxe", "test tool"));
        rules.put("place furnace", List.of("collect stone", "find location", "place building", "verify placement"));
        rules.put("defeat zombie", List.of("find weapon", "approach enemy", "attack"));
        rules.put("explore", List.of("move around", "map area", "find resources", "avoid danger"));
        return rules;
    }

    private static List<String> checkedSubgoals(String key, List<String> subgoals) {
        if (subgoals == null || subgoals.isEmpty() || subgoals.size() > MAX_SUBGOALS) {
            throw new IllegalArgumentException(
                    "Rule '" + key + "' must have between 1 and " + MAX_SUBGOALS + " subgoals: " + subgoals);
        }
        return List.copyOf(subgoals);
    }

    @Override
    public List<String> generateSubgoals(String goal, Object currentState) {
        String normalized = goal != null ? goal.toLowerCase(Locale.ROOT) : "";
        for (Map.Entry<String, List<String>> rule : rules.entrySet()) {
            if (normalized.contains(rule.getKey())) {
                return rule.getValue();
            }
        }
        return defaultSubgoals;
    }

    /** Fixed analysis: medium complexity, three steps. */
    @Override
    public TaskAnalysis analyzeTask(String task) {
        return new TaskAnalysis(task, BASIC_RATIONALE, Complexity.MEDIUM, BASIC_STEPS);
    }
}
