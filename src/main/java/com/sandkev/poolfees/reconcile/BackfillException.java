package com.sandkev.poolfees.reconcile;

/** Backfill could not reach the latest block; it is retried from the cursor already reached. */
public class BackfillException extends RuntimeException {

    public BackfillException(String message) {
        super(message);
    }
}
