package com.gamemind.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Subgoal generation switch and the cap on subgoals handed to the search. */
public final class SubgoalGenerationConfig {

    public static final int DEFAULT_MAX_SUBGOALS = 5;

    public static final SubgoalGenerationConfig DEFAULTS = new SubgoalGenerationConfig(null, null);

    private final boolean enabled;
    private final int maxSubgoals;

    @JsonCreator
    public SubgoalGenerationConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("maxSubgoals") Integer maxSubgoals) {
        this.enabled = enabled != null ? enabled : true;
        this.maxSubgoals = maxSubgoals != null ? maxSubgoals : DEFAULT_MAX_SUBGOALS;
        if (this.maxSubgoals < 1) {
            throw new IllegalArgumentException("subgoalGeneration.maxSubgoals must be >= 1 but was " + this.maxSubgoals);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getMaxSubgoals() {
        return maxSubgoals;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubgoalGenerationConfig that = (SubgoalGenerationConfig) o;
        return enabled == that.enabled && maxSubgoals == that.maxSubgoals;
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, maxSubgoals);
    }
}
