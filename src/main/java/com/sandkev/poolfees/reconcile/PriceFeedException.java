package com.sandkev.poolfees.reconcile;

public class PriceFeedException extends RuntimeException {

    public PriceFeedException(String message) {
        super(message);
    }
}
