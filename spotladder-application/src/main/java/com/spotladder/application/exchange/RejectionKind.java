package com.spotladder.application.exchange;

/**
 * How the exchange rejected a request. The transport classifies; callers only switch on the enum.
 */
public enum RejectionKind {
    /** The request carried a parameter name the venue does not accept (e.g. wrong size field). */
    UNRECOGNIZED_PARAMETER,
    /** The venue does not know the symbol spelling that was sent. */
    INVALID_SYMBOL,
    OTHER
}
