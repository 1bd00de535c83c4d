package com.gamemind.oracle.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemind.config.OracleConfig;
import com.gamemind.oracle.OracleBackend;
import com.gamemind.oracle.OracleBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link OracleBackend} that calls the Ollama HTTP API.
 * <p>
 * Generation uses {@code POST baseUrl/api/generate} with {@code stream=false} and the configured sampling
 * options; availability and model listing use {@code GET baseUrl/api/tags}. When an API key is configured
 * every request carries {@code Authorization: Bearer <key>}.
 * <p>
 * Safe for concurrent use: the only state is the configuration and one shared {@link HttpClient}.
 */
public final class OllamaClient implements OracleBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final OracleConfig config;
    private final HttpClient httpClient;

    public OllamaClient(OracleConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getProbeTimeout())
                .build();
    }

    @Override
    public String generate(String prompt, int maxTokens, double temperature) throws OracleBackendException {
        OllamaGenerateRequest.Options options = new OllamaGenerateRequest.Options(
                maxTokens, temperature, config.getTopP(), config.getRepeatPenalty());
        OllamaGenerateRequest req = new OllamaGenerateRequest(config.getModelName(), prompt, options);
        String json;
        try {
            json = MAPPER.writeValueAsString(req);
        } catch (JsonProcessingException e) {
            throw new OracleBackendException("Failed to encode Ollama request", e);
        }
        HttpRequest request = requestBuilder("/api/generate", config.getRequestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new OracleBackendException("Ollama API error: " + response.statusCode() + " " + response.body());
        }
        OllamaGenerateResponse resp;
        try {
            resp = MAPPER.readValue(response.body(), OllamaGenerateResponse.class);
        } catch (JsonProcessingException e) {
            throw new OracleBackendException("Unreadable Ollama response: " + e.getOriginalMessage(), e);
        }
        String text = resp != null && resp.getResponse() != null ? resp.getResponse() : "";
        log.debug("Ollama model {} returned {} characters", config.getModelName(), text.length());
        return text;
    }

    /**
     * True when {@code /api/tags} answers 200. Logs a warning when the configured model is not among the
     * listed models, since generation would then fail on every call.
     */
    @Override
    public boolean isAvailable() {
        List<String> models;
        try {
            models = fetchModels();
        } catch (OracleBackendException e) {
            log.warn("Ollama at {} is not available: {}", config.getBaseUrl(), e.getMessage());
            return false;
        }
        if (!models.contains(config.getModelName())) {
            log.warn("Model '{}' not found on Ollama at {}; available models: {}",
                    config.getModelName(), config.getBaseUrl(), models);
        }
        return true;
    }

    /** Names of the models the server has pulled; empty when the server cannot be reached. */
    public List<String> listModels() {
        try {
            return fetchModels();
        } catch (OracleBackendException e) {
            log.warn("Failed to list Ollama models: {}", e.getMessage());
            return List.of();
        }
    }

    private List<String> fetchModels() throws OracleBackendException {
        HttpRequest request = requestBuilder("/api/tags", config.getProbeTimeout()).GET().build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new OracleBackendException("Ollama API error: " + response.statusCode());
        }
        OllamaTagsResponse tags;
        try {
            tags = MAPPER.readValue(response.body(), OllamaTagsResponse.class);
        } catch (JsonProcessingException e) {
            throw new OracleBackendException("Unreadable Ollama model list: " + e.getOriginalMessage(), e);
        }
        List<String> names = new ArrayList<>();
        if (tags != null && tags.getModels() != null) {
            for (OllamaTagsResponse.Model m : tags.getModels()) {
                if (m != null && m.getName() != null) names.add(m.getName());
            }
        }
        return List.copyOf(names);
    }

    private HttpRequest.Builder requestBuilder(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.getBaseUrl() + path))
                .timeout(timeout);
        if (config.getApiKey() != null) {
            builder.header("Authorization", "Bearer " + config.getApiKey());
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) throws OracleBackendException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OracleBackendException("Ollama request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleBackendException("Interrupted while calling Ollama at " + request.uri(), e);
        }
    }
}
