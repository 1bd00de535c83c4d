package com.gamemind.oracle;

import com.gamemind.config.PromptTemplates;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/** Renders the configured prompt templates for a goal or task. */
final class OraclePrompts {

    private OraclePrompts() {
    }

    static String subgoalPrompt(PromptTemplates templates, String goal, Object currentState) {
        String prompt = templates.getSubgoalGeneration().replace(PromptTemplates.GOAL_PLACEHOLDER, goal);
        if (currentState != null) {
            prompt += "\n\nCurrent state: " + describeState(currentState);
        }
        return prompt;
    }

    static String taskAnalysisPrompt(PromptTemplates templates, String task) {
        return templates.getTaskAnalysis().replace(PromptTemplates.TASK_PLACEHOLDER, task);
    }

    static String describeState(Object state) {
        if (state instanceof Map || state instanceof Collection) {
            return state.toString();
        }
        if (state.getClass().isArray()) {
            return "Observation length: " + Array.getLength(state);
        }
        return String.valueOf(state);
    }
}
