package com.gamemind.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlannerConfigTest {

    @Test
    void defaults_matchDocumentedValues() {
        PlannerConfig config = PlannerConfig.defaults();

        assertTrue(config.isEnabled());
        assertEquals(100, config.getMctsSimulations());
        assertEquals(10, config.getMaxDepth());
        assertEquals(1.0, config.getExplorationConstant());
        assertEquals(10, config.getRolloutSteps());
        assertNull(config.getRandomSeed());
        assertTrue(config.getSubgoalGeneration().isEnabled());
        assertEquals(5, config.getSubgoalGeneration().getMaxSubgoals());

        OracleConfig oracle = config.getOracle();
        assertTrue(oracle.isEnabled());
        assertEquals("http://localhost:11434", oracle.getBaseUrl());
        assertEquals("llama2", oracle.getModelName());
        assertNull(oracle.getApiKey());
        assertEquals(128, oracle.getMaxTokens());
        assertEquals(0.7, oracle.getTemperature());
        assertEquals(30, oracle.getRequestTimeoutSeconds());
        assertEquals(5, oracle.getProbeTimeoutSeconds());
        assertTrue(oracle.getPrompts().getSubgoalGeneration().contains(PromptTemplates.GOAL_PLACEHOLDER));
        assertTrue(oracle.getPrompts().getTaskAnalysis().contains(PromptTemplates.TASK_PLACEHOLDER));
    }

    @Test
    void build_rejectsNonPositiveSimulations() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PlannerConfig.builder().mctsSimulations(0).build());
        assertTrue(e.getMessage().contains("mctsSimulations"));
    }

    @Test
    void build_rejectsNonPositiveMaxSubgoals() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PlannerConfig.builder().maxSubgoals(0).build());
        assertTrue(e.getMessage().contains("maxSubgoals"));
    }

    @Test
    void build_rejectsNonPositiveMaxDepth() {
        assertThrows(IllegalArgumentException.class, () -> PlannerConfig.builder().maxDepth(0).build());
    }

    @Test
    void build_rejectsNegativeOrNanExplorationConstant() {
        assertThrows(IllegalArgumentException.class, () -> PlannerConfig.builder().explorationConstant(-0.1).build());
        assertThrows(IllegalArgumentException.class,
                () -> PlannerConfig.builder().explorationConstant(Double.NaN).build());
    }

    @Test
    void build_acceptsZeroExplorationConstant() {
        assertEquals(0.0, PlannerConfig.builder().explorationConstant(0.0).build().getExplorationConstant());
    }

    @Test
    void oracleBuild_rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().maxTokens(0).build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().temperature(-1).build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().topP(0).build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().requestTimeoutSeconds(0).build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().probeTimeoutSeconds(0).build());
    }

    @Test
    void oracleBuild_normalizesBaseUrlAndBlankApiKey() {
        OracleConfig oracle = OracleConfig.builder().baseUrl(" http://ollama:11434/ ").apiKey("  ").build();

        assertEquals("http://ollama:11434", oracle.getBaseUrl());
        assertNull(oracle.getApiKey());
    }

    @Test
    void oracleBuild_rejectsBaseUrlWithoutHttpSchemeOrHost() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> OracleConfig.builder().baseUrl("localhost:11434").build());
        assertTrue(e.getMessage().contains("baseUrl"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().baseUrl("ftp://ollama:21").build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().baseUrl("http://").build());
        assertThrows(IllegalArgumentException.class, () -> OracleConfig.builder().baseUrl("http://bad host:1").build());
        assertEquals("https://ollama.example.com",
                OracleConfig.builder().baseUrl("https://ollama.example.com").build().getBaseUrl());
    }

    @Test
    void promptTemplates_requireTheirSlot() {
        assertThrows(IllegalArgumentException.class, () -> new PromptTemplates("List subgoals", null));
        assertThrows(IllegalArgumentException.class, () -> new PromptTemplates(null, "Analyze this"));
    }

    @Test
    void toBuilder_roundTripsEveryValue() {
        PlannerConfig original = PlannerConfig.builder()
                .enabled(false)
                .mctsSimulations(7)
                .maxDepth(2)
                .explorationConstant(0.5)
                .rolloutSteps(3)
                .randomSeed(42L)
                .subgoalGenerationEnabled(false)
                .maxSubgoals(2)
                .oracle(OracleConfig.builder().modelName("llama3.2").apiKey("secret").build())
                .build();

        assertEquals(original, original.toBuilder().build());
    }

    @Test
    void toString_masksApiKey() {
        OracleConfig oracle = OracleConfig.builder().apiKey("secret-token").build();

        assertFalse(oracle.toString().contains("secret-token"));
    }
}
