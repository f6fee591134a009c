package com.sandkev.poolfees.fee;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/** Latest known USD price and the instant it is valid as of. Published as one value. */
public record PriceState(BigDecimal price, Instant asOf) {

    public boolean isStaleFor(Instant transactionTime, Duration maxAge) {
        return Duration.between(asOf, transactionTime).compareTo(maxAge) > 0;
    }
}
