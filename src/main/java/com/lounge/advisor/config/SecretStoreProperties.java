package com.lounge.advisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Secrets available to {@code PropertiesSecretStore}, keyed by secret name.
 * Values are normally injected through environment variables.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lounge.secret-store")
public class SecretStoreProperties {

    private Map<String, SecretEntry> entries = new HashMap<>();

    @Data
    public static class SecretEntry {
        private String clientId;
        private String clientSecret;
    }
}
