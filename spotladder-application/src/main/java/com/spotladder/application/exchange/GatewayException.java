package com.spotladder.application.exchange;

import com.spotladder.domain.DomainException;

import java.util.Objects;

/**
 * The exchange rejected a request, or its response could not be interpreted.
 */
public class GatewayException extends DomainException {

    private final RejectionKind kind;

    public GatewayException(String message) {
        this(RejectionKind.OTHER, message);
    }

    public GatewayException(RejectionKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.kind = RejectionKind.OTHER;
    }

    public RejectionKind kind() {
        return kind;
    }
}
