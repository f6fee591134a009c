package com.sandkev.poolfees.price;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PriceClient {

    /**
     * Daily price points with {@code start <= timestamp < end}, ascending.
     * Empty list when {@code start >= end}; empty Optional when any upstream request fails.
     */
    Optional<List<PricePoint>> priceSeries(Instant start, Instant end);
}
