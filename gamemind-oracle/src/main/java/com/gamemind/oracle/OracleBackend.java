package com.gamemind.oracle;

/**
 * Text-generation backend behind a {@link RemoteOracle}: {@code {prompt, maxTokens, temperature}} in,
 * plain text or failure out. Calls block and must be bounded by a timeout.
 */
public interface OracleBackend {

    /**
     * Generates a completion for the prompt.
     *
     * @return generated text; may be empty
     * @throws OracleBackendException on any failure to obtain text
     */
    String generate(String prompt, int maxTokens, double temperature) throws OracleBackendException;

    /** Whether the backend answers a cheap health check. Never throws. */
    boolean isAvailable();
}
