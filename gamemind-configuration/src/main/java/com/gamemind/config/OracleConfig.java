package com.gamemind.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the remote subgoal oracle and its Ollama backend.
 * <p>
 * Null constructor arguments take the documented defaults; every value is validated on construction,
 * so an instance is always usable. {@code apiKey} is optional and sent as a bearer token when present.
 */
public final class OracleConfig {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL_NAME = "llama2";
    public static final int DEFAULT_MAX_TOKENS = 128;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final double DEFAULT_TOP_P = 0.9;
    public static final double DEFAULT_REPEAT_PENALTY = 1.1;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_PROBE_TIMEOUT_SECONDS = 5;

    public static final OracleConfig DEFAULTS = builder().build();

    private final boolean enabled;
    private final String baseUrl;
    private final String modelName;
    private final String apiKey;
    private final int maxTokens;
    private final double temperature;
    private final double topP;
    private final double repeatPenalty;
    private final int requestTimeoutSeconds;
    private final int probeTimeoutSeconds;
    private final boolean probeOnStart;
    private final PromptTemplates prompts;

    @JsonCreator
    public OracleConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("baseUrl") String baseUrl,
            @JsonProperty("modelName") String modelName,
            @JsonProperty("apiKey") String apiKey,
            @JsonProperty("maxTokens") Integer maxTokens,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("topP") Double topP,
            @JsonProperty("repeatPenalty") Double repeatPenalty,
            @JsonProperty("requestTimeoutSeconds") Integer requestTimeoutSeconds,
            @JsonProperty("probeTimeoutSeconds") Integer probeTimeoutSeconds,
            @JsonProperty("probeOnStart") Boolean probeOnStart,
            @JsonProperty("prompts") PromptTemplates prompts) {
        this.enabled = enabled != null ? enabled : true;
        this.baseUrl = stripTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL);
        this.modelName = modelName != null && !modelName.isBlank() ? modelName.trim() : DEFAULT_MODEL_NAME;
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
        this.maxTokens = maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
        this.temperature = temperature != null ? temperature : DEFAULT_TEMPERATURE;
        this.topP = topP != null ? topP : DEFAULT_TOP_P;
        this.repeatPenalty = repeatPenalty != null ? repeatPenalty : DEFAULT_REPEAT_PENALTY;
        this.requestTimeoutSeconds = requestTimeoutSeconds != null ? requestTimeoutSeconds : DEFAULT_REQUEST_TIMEOUT_SECONDS;
        this.probeTimeoutSeconds = probeTimeoutSeconds != null ? probeTimeoutSeconds : DEFAULT_PROBE_TIMEOUT_SECONDS;
        this.probeOnStart = probeOnStart != null ? probeOnStart : true;
        this.prompts = prompts != null ? prompts : PromptTemplates.DEFAULTS;

        requireHttpUrl(this.baseUrl);
        if (this.maxTokens < 1) {
            throw new IllegalArgumentException("oracle.maxTokens must be >= 1 but was " + this.maxTokens);
        }
        if (!(this.temperature >= 0)) {
            throw new IllegalArgumentException("oracle.temperature must be >= 0 but was " + this.temperature);
        }
        if (!(this.topP > 0 && this.topP <= 1)) {
            throw new IllegalArgumentException("oracle.topP must be in (0, 1] but was " + this.topP);
        }
        if (!(this.repeatPenalty > 0)) {
            throw new IllegalArgumentException("oracle.repeatPenalty must be > 0 but was " + this.repeatPenalty);
        }
        if (this.requestTimeoutSeconds < 1) {
            throw new IllegalArgumentException(
                    "oracle.requestTimeoutSeconds must be >= 1 but was " + this.requestTimeoutSeconds);
        }
        if (this.probeTimeoutSeconds < 1) {
            throw new IllegalArgumentException(
                    "oracle.probeTimeoutSeconds must be >= 1 but was " + this.probeTimeoutSeconds);
        }
    }

    private static void requireHttpUrl(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("oracle.baseUrl is not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException("oracle.baseUrl must be an http or https URL with a host but was " + url);
        }
    }

    private static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .baseUrl(baseUrl)
                .modelName(modelName)
                .apiKey(apiKey)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .requestTimeoutSeconds(requestTimeoutSeconds)
                .probeTimeoutSeconds(probeTimeoutSeconds)
                .probeOnStart(probeOnStart)
                .prompts(prompts);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Base URL without trailing slash, e.g. {@code http://localhost:11434}. */
    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    /** Bearer token for the backend, or null when none is configured. */
    public String getApiKey() {
        return apiKey;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getTopP() {
        return topP;
    }

    public double getRepeatPenalty() {
        return repeatPenalty;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public int getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public Duration getProbeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    /** Whether the remote oracle checks backend availability when it is created. */
    public boolean isProbeOnStart() {
        return probeOnStart;
    }

    public PromptTemplates getPrompts() {
        return prompts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OracleConfig that = (OracleConfig) o;
        return enabled == that.enabled
                && maxTokens == that.maxTokens
                && Double.compare(temperature, that.temperature) == 0
                && Double.compare(topP, that.topP) == 0
                && Double.compare(repeatPenalty, that.repeatPenalty) == 0
                && requestTimeoutSeconds == that.requestTimeoutSeconds
                && probeTimeoutSeconds == that.probeTimeoutSeconds
                && probeOnStart == that.probeOnStart
                && baseUrl.equals(that.baseUrl)
                && modelName.equals(that.modelName)
                && Objects.equals(apiKey, that.apiKey)
                && prompts.equals(that.prompts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, baseUrl, modelName, apiKey, maxTokens, temperature, topP, repeatPenalty,
                requestTimeoutSeconds, probeTimeoutSeconds, probeOnStart, prompts);
    }

    @Override
    public String toString() {
        return "OracleConfig{enabled=" + enabled
                + ", baseUrl=" + baseUrl
                + ", modelName=" + modelName
                + ", apiKey=" + (apiKey != null ? "***" : "none")
                + ", maxTokens=" + maxTokens
                + ", temperature=" + temperature
                + ", requestTimeoutSeconds=" + requestTimeoutSeconds + "}";
    }

    public static final class Builder {
        private Boolean enabled;
        private String baseUrl;
        private String modelName;
        private String apiKey;
        private Integer maxTokens;
        private Double temperature;
        private Double topP;
        private Double repeatPenalty;
        private Integer requestTimeoutSeconds;
        private Integer probeTimeoutSeconds;
        private Boolean probeOnStart;
        private PromptTemplates prompts;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(double topP) {
            this.topP = topP;
            return this;
        }

        public Builder repeatPenalty(double repeatPenalty) {
            this.repeatPenalty = repeatPenalty;
            return this;
        }

        public Builder requestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
            return this;
        }

        public Builder probeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = probeTimeoutSeconds;
            return this;
        }

        public Builder probeOnStart(boolean probeOnStart) {
            this.probeOnStart = probeOnStart;
            return this;
        }

        public Builder prompts(PromptTemplates prompts) {
            this.prompts = prompts;
            return this;
        }

        /** @throws IllegalArgumentException if any value is out of range */
        public OracleConfig build() {
            return new OracleConfig(enabled, baseUrl, modelName, apiKey, maxTokens, temperature, topP,
                    repeatPenalty, requestTimeoutSeconds, probeTimeoutSeconds, probeOnStart, prompts);
        }
    }
}
