package com.flowsmith.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "flowsmith.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "";
    private String openaiApiKey = "";
    private String anthropicApiKey = "";
    private int maxAttempts = 2;
    private double feedbackTemperature = 0.1;
    private boolean schemaConstrained = false;
    private Phase semantic = new Phase(0.3, 6000, Duration.ofSeconds(180));
    private Phase formalization = new Phase(0.0, 4000, Duration.ofSeconds(90));
    private Phase compilation = new Phase(0.0, 8000, Duration.ofSeconds(120));

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public double getFeedbackTemperature() {
        return feedbackTemperature;
    }

    public void setFeedbackTemperature(double feedbackTemperature) {
        this.feedbackTemperature = feedbackTemperature;
    }

    public Phase getSemantic() {
        return semantic;
    }

    public void setSemantic(Phase semantic) {
        this.semantic = semantic;
    }

    public Phase getFormalization() {
        return formalization;
    }

    public void setFormalization(Phase formalization) {
        this.formalization = formalization;
    }

    public Phase getCompilation() {
        return compilation;
    }

    public void setCompilation(Phase compilation) {
        this.compilation = compilation;
    }

    public boolean isSchemaConstrained() {
        return schemaConstrained;
    }

    public void setSchemaConstrained(boolean schemaConstrained) {
        this.schemaConstrained = schemaConstrained;
    }

    public boolean hasOpenaiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank();
    }

    public boolean hasAnthropicKey() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    /**
     * Generation settings for one pipeline phase.
     */
    public static class Phase {

        private double temperature;
        private int maxTokens;
        private Duration timeout;

        public Phase() {
            this(0.0, 4000, Duration.ofSeconds(120));
        }

        public Phase(double temperature, int maxTokens, Duration timeout) {
            this.temperature = temperature;
            this.maxTokens = maxTokens;
            this.timeout = timeout;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public GenerationOptions toOptions() {
            return new GenerationOptions(temperature, maxTokens, timeout);
        }
    }
}
