package com.sandkev.poolfees.fee;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fees by lower-cased transaction hash, plus the block cursor and the current price.
 *
 * <p>Unbounded: entries live as long as the process, which replays history on start.
 * Mutations take {@code lock} and never span a network call; reads are lock-free.
 */
@Component
public class FeeCache {

    private final Cache<String, BigDecimal> fees = Caffeine.newBuilder()
            .recordStats()
            .build();
    private final Object lock = new Object();

    private volatile long cursor;
    @Nullable
    private volatile PriceState priceState;

    /** Empty for a null or unknown hash, and for every hash while the cursor is still 0. */
    public Optional<BigDecimal> get(@Nullable String hash) {
        if (hash == null || cursor == 0) return Optional.empty();
        return Optional.ofNullable(fees.getIfPresent(normalize(hash)));
    }

    public void put(String hash, BigDecimal fee) {
        synchronized (lock) {
            fees.put(normalize(hash), fee);
        }
    }

    /** Stores a whole batch and moves the cursor forward (never back) in one step. */
    public void commit(Map<String, BigDecimal> batch, long newCursor) {
        synchronized (lock) {
            batch.forEach((hash, fee) -> fees.put(normalize(hash), fee));
            if (newCursor > cursor) cursor = newCursor;
        }
    }

    public long cursor() {
        return cursor;
    }

    public Optional<PriceState> priceState() {
        return Optional.ofNullable(priceState);
    }

    public void updatePrice(PriceState state) {
        synchronized (lock) {
            priceState = state;
        }
    }

    public long size() {
        return fees.estimatedSize();
    }

    public CacheStats stats() {
        return fees.stats();
    }

    private static String normalize(String hash) {
        return hash.toLowerCase(Locale.ROOT);
    }
}
