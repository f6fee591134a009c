package com.sandkev.poolfees.fee;

/** The cached price is older than the allowed age relative to the transaction being priced. */
public class StalePriceException extends FeeDataException {

    public StalePriceException(String message) {
        super(message);
    }
}
