package com.gamemind.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Prompt templates sent to the oracle backend. Each template has exactly one named slot:
 * {@link #GOAL_PLACEHOLDER} for subgoal generation and {@link #TASK_PLACEHOLDER} for task analysis.
 */
public final class PromptTemplates {

    /** Slot replaced with the goal text in {@link #getSubgoalGeneration()}. */
    public static final String GOAL_PLACEHOLDER = "{goal}";

    /** Slot replaced with the task text in {@link #getTaskAnalysis()}. */
    public static final String TASK_PLACEHOLDER = "{task}";

    public static final String DEFAULT_SUBGOAL_GENERATION = "Generate 3-5 specific subgoals for: " + GOAL_PLACEHOLDER;
    public static final String DEFAULT_TASK_ANALYSIS =
            "Analyze the current task: " + TASK_PLACEHOLDER + ". What are the key steps needed?";

    public static final PromptTemplates DEFAULTS = new PromptTemplates(null, null);

    private final String subgoalGeneration;
    private final String taskAnalysis;

    @JsonCreator
    public PromptTemplates(
            @JsonProperty("subgoalGeneration") String subgoalGeneration,
            @JsonProperty("taskAnalysis") String taskAnalysis) {
        this.subgoalGeneration = subgoalGeneration != null ? subgoalGeneration : DEFAULT_SUBGOAL_GENERATION;
        this.taskAnalysis = taskAnalysis != null ? taskAnalysis : DEFAULT_TASK_ANALYSIS;
        requireSlot("prompts.subgoalGeneration", this.subgoalGeneration, GOAL_PLACEHOLDER);
        requireSlot("prompts.taskAnalysis", this.taskAnalysis, TASK_PLACEHOLDER);
    }

    private static void requireSlot(String name, String template, String placeholder) {
        if (!template.contains(placeholder)) {
            throw new IllegalArgumentException(name + " must contain " + placeholder + " but was: " + template);
        }
    }

    public String getSubgoalGeneration() {
        return subgoalGeneration;
    }

    public String getTaskAnalysis() {
        return taskAnalysis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptTemplates that = (PromptTemplates) o;
        return subgoalGeneration.equals(that.subgoalGeneration) && taskAnalysis.equals(that.taskAnalysis);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subgoalGeneration, taskAnalysis);
    }
}
