package com.lounge.advisor.client;

import io.vertx.core.Future;

/**
 * Source of provider credentials. Fails with
 * {@link com.lounge.advisor.exception.SecretNotFoundException} when the named
 * secret does not exist or is incomplete.
 */
public interface SecretStore {

    Future<Credentials> getSecret(String name);
}
