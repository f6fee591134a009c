package com.sandkev.poolfees.fee;

/**
 * Upstream data that cannot be priced, such as a transaction without a hash.
 * Aborts the batch it was found in; nothing from that batch is committed.
 */
public class FeeDataException extends RuntimeException {

    public FeeDataException(String message) {
        super(message);
    }

    public FeeDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
