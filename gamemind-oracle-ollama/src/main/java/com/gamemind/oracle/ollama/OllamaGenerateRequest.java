package com.gamemind.oracle.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ollama /api/generate request body (non-streaming). */
final class OllamaGenerateRequest {

    private final String model;
    private final String prompt;
    @JsonProperty("stream")
    private final boolean stream;
    private final Options options;

    OllamaGenerateRequest(String model, String prompt, Options options) {
        this.model = model;
        this.prompt = prompt;
        this.stream = false;
        this.options = options;
    }

    public String getModel() { return model; }
    public String getPrompt() { return prompt; }
    public boolean isStream() { return stream; }
    public Options getOptions() { return options; }

    /** Sampling options; names follow the Ollama API. */
    static final class Options {
        @JsonProperty("num_predict")
        private final int numPredict;
        private final double temperature;
        @JsonProperty("top_p")
        private final double topP;
        @JsonProperty("repeat_penalty")
        private final double repeatPenalty;

        Options(int numPredict, double temperature, double topP, double repeatPenalty) {
            this.numPredict = numPredict;
            this.temperature = temperature;
            this.topP = topP;
            this.repeatPenalty = repeatPenalty;
        }

        public int getNumPredict() { return numPredict; }
        public double getTemperature() { return temperature; }
        public double getTopP() { return topP; }
        public double getRepeatPenalty() { return repeatPenalty; }
    }
}
