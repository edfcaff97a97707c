package com.planner.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the planner.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * Whether the planner is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the planner configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:planner.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
