package com.lounge.advisor.client;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;

/**
 * Extracts a readable message from a provider error response.
 * Looks at {@code errors[0].detail}, then {@code error_description}, then falls
 * back to the status line.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static String describe(HttpResponse<Buffer> response) {
        String fallback = "HTTP " + response.statusCode()
                + (response.statusMessage() != null ? " " + response.statusMessage() : "");
        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException | ClassCastException e) {
            return fallback;
        }
        if (body == null) {
            return fallback;
        }

        JsonArray errors = body.getJsonArray("errors");
        if (errors != null && !errors.isEmpty() && errors.getValue(0) instanceof JsonObject) {
            JsonObject first = errors.getJsonObject(0);
            String detail = first.getString("detail", first.getString("title"));
            if (detail != null) {
                return detail;
            }
        }
        String description = body.getString("error_description");
        if (description != null) {
            return description;
        }
        return body.getString("error", fallback);
    }
}
