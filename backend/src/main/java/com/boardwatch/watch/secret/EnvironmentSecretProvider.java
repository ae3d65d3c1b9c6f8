package com.boardwatch.watch.secret;

import com.boardwatch.config.WatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class EnvironmentSecretProvider implements SecretProvider {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentSecretProvider.class);

    private final WatchProperties properties;
    private final Environment environment;

    public EnvironmentSecretProvider(WatchProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @Override
    public String getSecret(String name) {
        if (name == null || name.isBlank()) {
            throw new SecretAccessException("Secret name is required");
        }
        String value = properties.getSecrets().getValues().get(name);
        if (value == null || value.isBlank()) {
            try {
                value = environment.getProperty(name);
            } catch (RuntimeException e) {
                throw new SecretAccessException("Failed to read secret " + name, e);
            }
        }
        if (value == null || value.isBlank()) {
            throw new SecretAccessException("Secret " + name + " is not configured or empty");
        }
        log.debug("Resolved secret {}", name);
        return value.trim();
    }
}
