package com.lounge.advisor.client;

import com.lounge.advisor.config.SecretStoreProperties;
import com.lounge.advisor.exception.SecretNotFoundException;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads secrets from {@code lounge.secret-store.entries}. Values are expected to
 * arrive through environment variables, never from a committed file.
 */
@Component
@Slf4j
public class PropertiesSecretStore implements SecretStore {

    @Autowired
    private SecretStoreProperties secretStoreProperties;

    @Override
    public Future<Credentials> getSecret(String name) {
        SecretStoreProperties.SecretEntry entry = secretStoreProperties.getEntries().get(name);

        if (entry == null) {
            log.error("Secret {} is not configured", name);
            return Future.failedFuture(new SecretNotFoundException("Secret not found: " + name));
        }
        if (isBlank(entry.getClientId()) || isBlank(entry.getClientSecret())) {
            log.error("Secret {} is missing client id or client secret", name);
            return Future.failedFuture(new SecretNotFoundException("Secret is incomplete: " + name));
        }

        return Future.succeededFuture(new Credentials(entry.getClientId(), entry.getClientSecret()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
