package com.sandkev.poolfees.price;

import java.math.BigDecimal;
import java.time.Instant;

/** One daily candle reduced to its open time and open price (USD). */
public record PricePoint(long timestampMillis, BigDecimal price) {

    public Instant timestamp() {
        return Instant.ofEpochMilli(timestampMillis);
    }
}
