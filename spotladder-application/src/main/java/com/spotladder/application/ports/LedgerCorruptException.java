package com.spotladder.application.ports;

import com.spotladder.domain.DomainException;

/**
 * The ledger exists but is not well-formed. Fatal: nothing repairs it automatically.
 */
public class LedgerCorruptException extends DomainException {

    public LedgerCorruptException(String message) {
        super(message);
    }

    public LedgerCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
