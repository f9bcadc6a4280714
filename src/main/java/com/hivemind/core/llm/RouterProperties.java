package com.hivemind.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "hivemind.router")
public class RouterProperties {

    /** Spend ceiling in USD; zero or less disables the check. */
    private double budgetUsd = 1.0;
    private int maxRetries = 3;
    /** Consecutive agent-loop failures before an agent is routed through the planner cascade. */
    private int escalationThreshold = 3;
    private double temperature = 0.7;
    private String plannerRole = "orchestrator";
    private Map<String, Provider> providers = new LinkedHashMap<>();
    /** Model roster; empty means the built-in catalog. */
    private List<Model> models = new ArrayList<>();
    /** Per-role cascades keyed by lowercase role; empty means the built-in cascades. */
    private Map<String, List<String>> cascades = new LinkedHashMap<>();
    private List<String> defaultCascade = new ArrayList<>();

    public double getBudgetUsd() {
        return budgetUsd;
    }

    public void setBudgetUsd(double budgetUsd) {
        this.budgetUsd = budgetUsd;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getEscalationThreshold() {
        return escalationThreshold;
    }

    public void setEscalationThreshold(int escalationThreshold) {
        this.escalationThreshold = escalationThreshold;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public String getPlannerRole() {
        return plannerRole;
    }

    public void setPlannerRole(String plannerRole) {
        this.plannerRole = plannerRole;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public List<Model> getModels() {
        return models;
    }

    public void setModels(List<Model> models) {
        this.models = models;
    }

    public Map<String, List<String>> getCascades() {
        return cascades;
    }

    public void setCascades(Map<String, List<String>> cascades) {
        this.cascades = cascades;
    }

    public List<String> getDefaultCascade() {
        return defaultCascade;
    }

    public void setDefaultCascade(List<String> defaultCascade) {
        this.defaultCascade = defaultCascade;
    }

    /**
     * Configured roster, falling back to {@link ModelCatalog#ALL_MODELS}.
     */
    public List<ModelSpec> resolveModels() {
        if (models == null || models.isEmpty()) {
            return ModelCatalog.ALL_MODELS;
        }
        return models.stream().map(Model::toSpec).toList();
    }

    public Map<String, List<String>> resolveCascades() {
        if (cascades == null || cascades.isEmpty()) {
            return ModelCatalog.ROLE_CASCADES;
        }
        return cascades;
    }

    public List<String> resolveDefaultCascade() {
        if (defaultCascade == null || defaultCascade.isEmpty()) {
            return ModelCatalog.DEFAULT_CASCADE;
        }
        return defaultCascade;
    }

    /**
     * An OpenAI-compatible endpoint. Providers without an API key are skipped.
     */
    public static class Provider {
        private String baseUrl = "";
        private String completionsPath = "/v1/chat/completions";
        private String apiKey = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Model {
        private String name;
        private String provider;
        private int rpm = 10;
        private double costIn;
        private double costOut;
        private String tier = "standard";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getRpm() {
            return rpm;
        }

        public void setRpm(int rpm) {
            this.rpm = rpm;
        }

        public double getCostIn() {
            return costIn;
        }

        public void setCostIn(double costIn) {
            this.costIn = costIn;
        }

        public double getCostOut() {
            return costOut;
        }

        public void setCostOut(double costOut) {
            this.costOut = costOut;
        }

        public String getTier() {
            return tier;
        }

        public void setTier(String tier) {
            this.tier = tier;
        }

        ModelSpec toSpec() {
            return new ModelSpec(name, provider, rpm, costIn, costOut, tier);
        }
    }
}
