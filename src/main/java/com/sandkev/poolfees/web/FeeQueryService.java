package com.sandkev.poolfees.web;

import com.sandkev.poolfees.fee.FeeCache;
import com.sandkev.poolfees.reconcile.ReconciliationEngine;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/** Read side of the fee cache. Never touches the network. */
@Service
public class FeeQueryService {

    private final FeeCache cache;
    private final ReconciliationEngine engine;

    public FeeQueryService(FeeCache cache, ReconciliationEngine engine) {
        this.cache = cache;
        this.engine = engine;
    }

    /** Empty for a null hash, for an unknown hash, and for every hash until backfill has completed. */
    public Optional<BigDecimal> feeFor(@Nullable String hash) {
        if (hash == null || !engine.isReady()) return Optional.empty();
        return cache.get(hash);
    }
}
