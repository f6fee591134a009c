package com.sandkev.poolfees.web;

import com.sandkev.poolfees.fee.FeeCache;
import com.sandkev.poolfees.fee.PriceState;
import com.sandkev.poolfees.reconcile.ReconciliationEngine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
class StatusController {

    private final ReconciliationEngine engine;
    private final FeeCache cache;

    StatusController(ReconciliationEngine engine, FeeCache cache) {
        this.engine = engine;
        this.cache = cache;
    }

    @GetMapping("/status")
    Map<String, Object> status() {
        PriceState price = cache.priceState().orElse(null);
        var out = new LinkedHashMap<String, Object>(); // price fields are null before backfill completes
        out.put("phase", engine.phase());
        out.put("ready", engine.isReady());
        out.put("cursor", cache.cursor());
        out.put("cachedFees", cache.size());
        out.put("price", price == null ? null : price.price());
        out.put("priceAsOf", price == null ? null : price.asOf().toString());
        out.put("hitRate", cache.stats().hitRate());
        return out;
    }
}
