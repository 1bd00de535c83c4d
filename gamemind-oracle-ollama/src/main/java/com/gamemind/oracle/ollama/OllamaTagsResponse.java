package com.gamemind.oracle.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Ollama /api/tags response: locally available models. */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaTagsResponse {

    private List<Model> models;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Model {
        private String name;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    public List<Model> getModels() { return models; }
    public void setModels(List<Model> models) { this.models = models; }
}
