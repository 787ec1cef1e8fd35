package com.spotladder.application.ports;

import com.spotladder.domain.DomainException;

public class LedgerWriteException extends DomainException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
