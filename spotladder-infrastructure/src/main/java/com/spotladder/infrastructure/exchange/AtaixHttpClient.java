package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.exchange.RejectionKind;
import com.spotladder.application.ports.ConfigPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * OkHttp wrapper for the ATAIX REST API: JSON in and out, API key headers, envelope unwrapping.
 */
public final class AtaixHttpClient implements AtaixTransport {

    private static final Logger log = LoggerFactory.getLogger(AtaixHttpClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final OkHttpClient client;
    private final ObjectMapper om;

    public AtaixHttpClient(String baseUrl, String apiKey, String apiSecret, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.client = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
        this.om = new ObjectMapper();
    }

    public static AtaixHttpClient fromConfig(ConfigPort config) {
        String baseUrl = config.get(ConfigKey.ATAIX_BASE_URL.key(), ConfigKey.ATAIX_BASE_URL.defaultValue());
        int seconds = config.getInt(ConfigKey.ATAIX_TIMEOUT_SECONDS.key(),
                Integer.parseInt(ConfigKey.ATAIX_TIMEOUT_SECONDS.defaultValue()));
        return new AtaixHttpClient(baseUrl,
                config.getSecret(ConfigKey.ATAIX_API_KEY.key()),
                config.getSecret(ConfigKey.ATAIX_API_SECRET.key()),
                Duration.ofSeconds(Math.max(1, seconds)));
    }

    @Override
    public JsonNode request(String method, String path, JsonNode body) {
        String m = method.toUpperCase(Locale.ROOT);
        Request.Builder rb = new Request.Builder()
                .url(baseUrl + path)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) rb.header("X-API-KEY", apiKey);
        if (apiSecret != null && !apiSecret.isBlank()) rb.header("X-API-SECRET", apiSecret);

        RequestBody requestBody = null;
        if (body != null) {
            try {
                requestBody = RequestBody.create(om.writeValueAsString(body), JSON);
            } catch (JsonProcessingException e) {
                throw new GatewayException("Cannot serialize request body for " + m + " " + path, e);
            }
        }
        rb.method(m, requestBody);

        log.debug("{} {}", m, path);
        try (Response resp = client.newCall(rb.build()).execute()) {
            ResponseBody rbody = resp.body();
            String text = rbody != null ? rbody.string() : "";
            return interpret(resp.code(), text);
        } catch (IOException e) {
            throw new GatewayException(m + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Applies the envelope rules to a raw response.
     */
    JsonNode interpret(int code, String body) {
        String text = body == null ? "" : body;
        JsonNode payload = null;
        if (!text.isBlank()) {
            try {
                payload = om.readTree(text);
            } catch (JsonProcessingException e) {
                if (code >= 200 && code < 300) {
                    throw new GatewayException("Unparseable response from exchange: " + text, e);
                }
            }
        }

        if (code < 200 || code >= 300) {
            String message = messageOf(payload);
            throw rejection(message != null ? message : "HTTP " + code + ": " + text);
        }
        if (payload == null) {
            return om.createObjectNode();
        }
        if (payload.isObject()) {
            JsonNode status = payload.get("status");
            if (status != null && status.isBoolean() && !status.booleanValue()) {
                String message = messageOf(payload);
                throw rejection("ATAIX rejected the request: " + (message != null ? message : payload.toString()));
            }
            JsonNode result = payload.get("result");
            if (result != null) return result;
        }
        return payload;
    }

    static GatewayException rejection(String message) {
        return new GatewayException(classify(message), message);
    }

    static RejectionKind classify(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("unexpected parameter") || m.contains("unknown parameter") || m.contains("unrecognized parameter")) {
            return RejectionKind.UNRECOGNIZED_PARAMETER;
        }
        if (m.contains("invalid symbol")) {
            return RejectionKind.INVALID_SYMBOL;
        }
        return RejectionKind.OTHER;
    }

    private static String messageOf(JsonNode payload) {
        if (payload == null || !payload.isObject()) return null;
        JsonNode msg = payload.get("message");
        if (msg == null || msg.isNull()) return null;
        return msg.isTextual() ? msg.asText() : msg.toString();
    }
}
