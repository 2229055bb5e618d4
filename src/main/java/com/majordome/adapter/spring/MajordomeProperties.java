package com.majordome.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Majordome.
 */
@ConfigurationProperties(prefix = "majordome")
public class MajordomeProperties {

    /**
     * Whether Majordome is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Majordome configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:majordome.yaml";

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
