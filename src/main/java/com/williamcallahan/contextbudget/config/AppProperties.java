package com.williamcallahan.contextbudget.config;

import com.williamcallahan.contextbudget.application.trim.BudgetAllocator;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Trim trim = new Trim();
    private Retention retention = new Retention();

    public Trim getTrim() {
        return trim;
    }

    public void setTrim(Trim trim) {
        this.trim = trim;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    /**
     * Rejects settings the trimming engine cannot honor.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (trim.getFloorTokens() <= 0) {
            throw new IllegalArgumentException("app.trim.floor-tokens must be positive, got " + trim.getFloorTokens());
        }
        if (trim.getDefaultTargetTokens() <= 0) {
            throw new IllegalArgumentException(
                    "app.trim.default-target-tokens must be positive, got " + trim.getDefaultTargetTokens());
        }
        if (trim.getDefaultMinTurns() < 0) {
            throw new IllegalArgumentException(
                    "app.trim.default-min-turns cannot be negative, got " + trim.getDefaultMinTurns());
        }
        if (trim.getDefaultModel() == null || trim.getDefaultModel().isBlank()) {
            throw new IllegalArgumentException("app.trim.default-model is required");
        }
    }

    public static class Trim {
        private int floorTokens = BudgetAllocator.DEFAULT_FLOOR_TOKENS;
        private int defaultTargetTokens = 4096;
        private int defaultMinTurns = 0;
        private String defaultModel = "gpt-4o-mini";

        public int getFloorTokens() { return floorTokens; }
        public void setFloorTokens(int floorTokens) { this.floorTokens = floorTokens; }

        public int getDefaultTargetTokens() { return defaultTargetTokens; }
        public void setDefaultTargetTokens(int defaultTargetTokens) { this.defaultTargetTokens = defaultTargetTokens; }

        public int getDefaultMinTurns() { return defaultMinTurns; }
        public void setDefaultMinTurns(int defaultMinTurns) { this.defaultMinTurns = defaultMinTurns; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }

    public static class Retention {
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
