package com.spotladder.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotladder.application.exchange.GatewayException;

/**
 * Authenticated request/response exchange with the ATAIX REST API.
 *
 * <p>Implementations unwrap the response envelope and turn every rejection into a {@link GatewayException}
 * whose {@link com.spotladder.application.exchange.RejectionKind} is already classified.
 */
public interface AtaixTransport {

    /**
     * @param method HTTP method (GET, POST, DELETE)
     * @param path   path below the base URL, starting with '/'
     * @param body   JSON body, or null
     * @return the payload's {@code result} field, or the payload itself when there is none
     */
    JsonNode request(String method, String path, JsonNode body);
}
