package com.boardwatch.watch.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ConfigurationNotFoundException extends RuntimeException {
    private final String configurationId;

    public ConfigurationNotFoundException(String configurationId) {
        super("Configuration not found: " + configurationId);
        this.configurationId = configurationId;
    }

    public String getConfigurationId() {
        return configurationId;
    }
}
