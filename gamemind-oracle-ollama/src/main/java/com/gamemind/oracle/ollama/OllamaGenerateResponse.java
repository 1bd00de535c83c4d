package com.gamemind.oracle.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Ollama /api/generate response (non-streaming). Ignores extra fields (created_at, context, durations). */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaGenerateResponse {

    private String model;
    private String response;
    private Boolean done;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getResponse() { return response; }
    public void setResponse(String response) { this.response = response; }
    public Boolean getDone() { return done; }
    public void setDone(Boolean done) { this.done = done; }
}
