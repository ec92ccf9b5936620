package com.lounge.advisor.client;

import com.lounge.advisor.config.FlightProviderProperties;
import com.lounge.advisor.exception.AuthenticationException;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * -@Component: process-wide holder of the provider credentials and bearer token
 * --Credentials are loaded from the SecretStore and kept for credentials-ttl
 * --The token is kept until expiresAt minus token-safety-margin
 * --Concurrent callers during a refresh share the same in-flight refresh, so
 * the token endpoint sees a single request
 * --WithoutIT: every flight lookup would hit the secret store and the token
 * endpoint.
 * <p>
 * All mutable state is guarded by this object's monitor.
 */
@Component
@Slf4j
public class CredentialCache {

    @Autowired
    private SecretStore secretStore;

    @Autowired
    private WebClient webClient;

    @Autowired
    private FlightProviderProperties properties;

    @Autowired
    private Clock clock;

    private Credentials credentials;
    private Instant credentialsFetchedAt;
    private Token token;
    private Future<Token> pendingRefresh;

    /**
     * Returns a usable bearer token, refreshing it when missing or about to expire.
     * Fails with {@link AuthenticationException}.
     */
    public synchronized Future<Token> getToken() {
        Instant now = clock.instant();

        if (token != null && token.isUsableAt(now, properties.getTokenSafetyMargin())) {
            log.debug("Using cached provider token, expires at {}", token.getExpiresAt());
            return Future.succeededFuture(token);
        }

        if (pendingRefresh != null) {
            log.debug("Token refresh already in flight - joining it");
            return pendingRefresh;
        }

        log.info("Requesting new provider token");
        Future<Token> refresh = loadCredentials(now)
                .compose(this::requestToken)
                .andThen(this::completeRefresh);

        // A refresh that completed synchronously has already updated the state
        if (!refresh.isComplete()) {
            pendingRefresh = refresh;
        }
        return refresh;
    }

    /**
     * Drops the cached token if it is still the one the provider rejected with 401.
     * A token refreshed in the meantime is kept.
     */
    public synchronized void invalidate(Token rejected) {
        if (token == null || token != rejected) {
            log.debug("Rejected token is no longer cached - nothing to invalidate");
            return;
        }
        log.info("Invalidating provider token that expires at {}", token.getExpiresAt());
        token = null;
    }

    public synchronized boolean hasValidToken() {
        return token != null && token.isUsableAt(clock.instant(), properties.getTokenSafetyMargin());
    }

    private synchronized void completeRefresh(AsyncResult<Token> result) {
        pendingRefresh = null;
        if (result.succeeded()) {
            token = result.result();
            log.info("Provider token refreshed, expires at {}", token.getExpiresAt());
        } else {
            log.error("Provider token refresh failed: {}", result.cause().getMessage());
        }
    }

    private synchronized void storeCredentials(Credentials fetched, Instant fetchedAt) {
        credentials = fetched;
        credentialsFetchedAt = fetchedAt;
    }

    private Future<Credentials> loadCredentials(Instant now) {
        if (credentials != null && now.isBefore(credentialsFetchedAt.plus(properties.getCredentialsTtl()))) {
            return Future.succeededFuture(credentials);
        }

        log.info("Loading provider credentials from secret {}", properties.getSecretName());
        return secretStore.getSecret(properties.getSecretName())
                .recover(err -> Future.failedFuture(err instanceof AuthenticationException
                        ? err
                        : new AuthenticationException("Unable to load provider credentials: " + err.getMessage(), err)))
                .onSuccess(fetched -> storeCredentials(fetched, now));
    }

    private Future<Token> requestToken(Credentials creds) {
        MultiMap form = MultiMap.caseInsensitiveMultiMap()
                .set("grant_type", "client_credentials")
                .set("client_id", creds.getClientId())
                .set("client_secret", creds.getClientSecret());

        return webClient.postAbs(properties.getBaseUrl() + properties.getTokenPath())
                .timeout(properties.getRequestTimeout().toMillis())
                .sendForm(form)
                .recover(err -> Future.failedFuture(
                        new AuthenticationException("Token endpoint unreachable: " + err.getMessage(), err)))
                .compose(this::toToken);
    }

    private Future<Token> toToken(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            return Future.failedFuture(new AuthenticationException(
                    "Token request rejected (" + response.statusCode() + "): " + ProviderErrors.describe(response)));
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException e) {
            return Future.failedFuture(new AuthenticationException("Token response is not valid JSON", e));
        }

        String accessToken = body == null ? null : body.getString("access_token");
        Long expiresIn = body == null ? null : body.getLong("expires_in");
        if (accessToken == null || expiresIn == null) {
            return Future.failedFuture(
                    new AuthenticationException("Token response is missing access_token or expires_in"));
        }

        return Future.succeededFuture(new Token(accessToken, clock.instant().plusSeconds(expiresIn)));
    }
}
