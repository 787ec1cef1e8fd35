package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotladder.application.exchange.GatewayException;
import com.spotladder.application.exchange.RejectionKind;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.spotladder.infrastructure.exchange.ScriptedTransport.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtaixHttpClientTransportTest {

    private MockWebServer server;

    @BeforeEach
    void start() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stop() throws IOException {
        server.shutdown();
    }

    private AtaixHttpClient client(String key, String secret) {
        return new AtaixHttpClient(server.url("/api/").toString(), key, secret, Duration.ofSeconds(1));
    }

    @Test
    void postSendsJsonBodyAndKeyHeaders() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"status\":true,\"result\":{\"orderID\":\"77\"}}"));

        JsonNode result = client("key-1", "secret-1")
                .request("post", "/orders", json("{'symbol':'LTC/USDT','side':'buy','quantity':'1.5'}"));

        assertThat(result.get("orderID").asText()).isEqualTo("77");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/api/orders");
        assertThat(recorded.getHeader("X-API-KEY")).isEqualTo("key-1");
        assertThat(recorded.getHeader("X-API-SECRET")).isEqualTo("secret-1");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(json(recorded.getBody().readUtf8()))
                .isEqualTo(json("{'symbol':'LTC/USDT','side':'buy','quantity':'1.5'}"));
    }

    @Test
    void getWithoutCredentialsOmitsKeyHeaders() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("[{\"symbol\":\"LTC/USDT\",\"bid\":\"0.5\"}]"));

        JsonNode result = client(null, " ").request("GET", "/prices", null);

        assertThat(result.isArray()).isTrue();
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getHeader("X-API-KEY")).isNull();
        assertThat(recorded.getHeader("X-API-SECRET")).isNull();
        assertThat(recorded.getBodySize()).isZero();
    }

    @Test
    void deleteReachesOrderPath() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"status\":true,\"result\":null}"));

        JsonNode result = client("k", "s").request("DELETE", "/orders/A-1", null);

        assertThat(result.isNull()).isTrue();
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("DELETE");
        assertThat(recorded.getPath()).isEqualTo("/api/orders/A-1");
    }

    @Test
    void httpErrorBodyBecomesClassifiedRejection() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"status\":false,\"message\":\"Unexpected parameter: quantity\"}"));

        assertThatThrownBy(() -> client("k", "s").request("POST", "/orders", json("{'quantity':'1'}")))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.kind()).isEqualTo(RejectionKind.UNRECOGNIZED_PARAMETER);
                    assertThat(e.getMessage()).contains("Unexpected parameter");
                });
    }

    @Test
    void silentServerTimesOutAsGatewayError() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThatThrownBy(() -> client("k", "s").request("GET", "/prices", null))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.kind()).isEqualTo(RejectionKind.OTHER);
                    assertThat(e.getMessage()).contains("GET /prices failed");
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
    }
}
