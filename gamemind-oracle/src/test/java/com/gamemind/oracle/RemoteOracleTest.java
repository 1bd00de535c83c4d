package com.gamemind.oracle;

import com.gamemind.config.OracleConfig;
import com.gamemind.config.PromptTemplates;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoteOracleTest {

    private static final OracleConfig CONFIG = OracleConfig.builder().maxTokens(64).temperature(0.3).build();

    @Test
    void generateSubgoals_parsesBackendResponse() {
        StubBackend backend = StubBackend.replying("1. Find trees\n2. Chop wood\n\n3. Return");
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);

        assertTrue(oracle.isAvailable());
        assertEquals(List.of("Find trees", "Chop wood", "Return"), oracle.generateSubgoals("collect wood"));
        assertEquals(64, backend.lastMaxTokens);
        assertEquals(0.3, backend.lastTemperature);
    }

    @Test
    void generateSubgoals_promptCarriesGoalAndStateDescription() {
        StubBackend backend = StubBackend.replying("Find trees");
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);

        oracle.generateSubgoals("collect wood", Map.of("wood", 2));
        oracle.generateSubgoals("collect wood", new float[] {0.1f, 0.2f, 0.3f});
        oracle.generateSubgoals("collect wood", null);

        assertEquals("Generate 3-5 specific subgoals for: collect wood\n\nCurrent state: {wood=2}",
                backend.prompts.get(0));
        assertTrue(backend.prompts.get(1).endsWith("Current state: Observation length: 3"));
        assertEquals("Generate 3-5 specific subgoals for: collect wood", backend.prompts.get(2));
    }

    @Test
    void generateSubgoals_usesConfiguredTemplate() {
        OracleConfig config = OracleConfig.builder()
                .prompts(new PromptTemplates("Steps for {goal}:", null))
                .build();
        StubBackend backend = StubBackend.replying("Find trees");

        new RemoteOracle(backend, config).generateSubgoals("collect wood");

        assertEquals("Steps for collect wood:", backend.prompts.get(0));
    }

    @Test
    void generateSubgoals_backendFailureFallsBack() {
        RemoteOracle oracle = new RemoteOracle(StubBackend.failing(), CONFIG);

        assertEquals(List.of("find trees", "chop wood", "gather resources", "return to base"),
                oracle.generateSubgoals("collect wood"));
    }

    @Test
    void generateSubgoals_unexpectedRuntimeErrorFallsBack() {
        StubBackend backend = StubBackend.replying("unused");
        backend.runtimeFailure = new IllegalStateException("boom");
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);

        assertEquals(FallbackOracle.DEFAULT_SUBGOALS, oracle.generateSubgoals("build a castle"));
    }

    @Test
    void generateSubgoals_unprintableStateFallsBackWithoutCallingBackend() {
        StubBackend backend = StubBackend.replying("1. Find trees");
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);
        Object state = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("observation not printable");
            }
        };

        assertEquals(List.of("find trees", "chop wood", "gather resources", "return to base"),
                oracle.generateSubgoals("collect wood", state));
        assertTrue(backend.prompts.isEmpty());
    }

    @Test
    void generateSubgoals_unusableResponseFallsBack() {
        RemoteOracle oracle = new RemoteOracle(StubBackend.replying("1. ok\n\n-"), CONFIG);

        assertEquals(List.of("find weapon", "approach enemy", "attack"), oracle.generateSubgoals("defeat zombie"));
    }

    @Test
    void failedProbe_routesEverythingToFallbackWithoutCallingBackend() {
        StubBackend backend = StubBackend.replying("1. Find trees");
        backend.available = false;
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);

        assertFalse(oracle.isAvailable());
        assertEquals(FallbackOracle.DEFAULT_SUBGOALS, oracle.generateSubgoals("wander"));
        assertEquals(Complexity.MEDIUM, oracle.analyzeTask("wander").complexity());
        assertTrue(backend.prompts.isEmpty());
    }

    @Test
    void probeThrowing_isTreatedAsUnavailable() {
        StubBackend backend = StubBackend.replying("1. Find trees");
        backend.probeFailure = new IllegalStateException("connection refused");

        assertFalse(new RemoteOracle(backend, CONFIG).isAvailable());
    }

    @Test
    void probeDisabled_skipsAvailabilityCheck() {
        StubBackend backend = StubBackend.replying("Find trees");
        backend.available = false;
        RemoteOracle oracle = new RemoteOracle(backend, OracleConfig.builder().probeOnStart(false).build());

        assertTrue(oracle.isAvailable());
        assertEquals(List.of("Find trees"), oracle.generateSubgoals("collect wood"));
    }

    @Test
    void analyzeTask_derivesFieldsFromResponse() {
        StubBackend backend = StubBackend.replying("  Find a tree, collect wood and craft planks.  ");
        RemoteOracle oracle = new RemoteOracle(backend, CONFIG);

        TaskAnalysis analysis = oracle.analyzeTask("make planks");

        assertEquals("Analyze the current task: make planks. What are the key steps needed?", backend.prompts.get(0));
        assertEquals("make planks", analysis.task());
        assertEquals("Find a tree, collect wood and craft planks.", analysis.rationale());
        assertEquals(Complexity.SIMPLE, analysis.complexity());
        assertEquals(3, analysis.estimatedSteps());
    }

    @Test
    void analyzeTask_emptyOrFailedResponseFallsBack() {
        TaskAnalysis blank = new RemoteOracle(StubBackend.replying("  "), CONFIG).analyzeTask("dig");
        TaskAnalysis failed = new RemoteOracle(StubBackend.failing(), CONFIG).analyzeTask("dig");

        assertEquals("Basic task analysis", blank.rationale());
        assertEquals("Basic task analysis", failed.rationale());
        assertEquals(3, failed.estimatedSteps());
    }

    private static final class StubBackend implements OracleBackend {
        final List<String> prompts = new ArrayList<>();
        String response;
        boolean fail;
        boolean available = true;
        RuntimeException runtimeFailure;
        RuntimeException probeFailure;
        int lastMaxTokens;
        double lastTemperature;

        static StubBackend replying(String response) {
            StubBackend backend = new StubBackend();
            backend.response = response;
            return backend;
        }

        static StubBackend failing() {
            StubBackend backend = new StubBackend();
            backend.fail = true;
            return backend;
        }

        @Override
        public String generate(String prompt, int maxTokens, double temperature) throws OracleBackendException {
            prompts.add(prompt);
            lastMaxTokens = maxTokens;
            lastTemperature = temperature;
            if (runtimeFailure != null) throw runtimeFailure;
            if (fail) throw new OracleBackendException("request timed out");
            return response;
        }

        @Override
        public boolean isAvailable() {
            if (probeFailure != null) throw probeFailure;
            return available;
        }
    }
}
