package com.sandkev.poolfees.price;

import com.sandkev.poolfees.config.BinanceClientConfig.BinanceClientProperties;
import com.sandkev.poolfees.shared.http.QueryParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Daily candles from /api/v3/klines. The endpoint caps a request at {@code limit} candles, so longer
 * ranges are walked window by window. Windows are fetched one after another: the upstream weight
 * limit does not tolerate parallel bursts.
 */
@Slf4j
@RequiredArgsConstructor
public class BinanceKlinePriceClient implements PriceClient {

    static final String KLINES_PATH = "/api/v3/klines";

    private static final ParameterizedTypeReference<List<List<Object>>> CANDLES =
            new ParameterizedTypeReference<>() {};

    private final WebClient client;
    private final BinanceClientProperties props;

    @Override
    public Optional<List<PricePoint>> priceSeries(Instant start, Instant end) {
        if (!start.isBefore(end)) return Optional.of(List.of());

        final long endMs = end.toEpochMilli();
        final long windowMs = Duration.ofDays(props.maxWindowDays()).toMillis();
        var out = new ArrayList<PricePoint>();

        long windowStart = start.toEpochMilli();
        while (windowStart < endMs) {
            // endTime is inclusive upstream
            long windowEnd = Math.min(endMs - 1, windowStart + windowMs - 1);

            List<List<Object>> candles = fetch(windowStart, windowEnd);
            if (candles == null) return Optional.empty();
            try {
                for (List<Object> c : candles) out.add(toPoint(c));
            } catch (RuntimeException e) {
                log.warn("Malformed candle for {} window [{}, {}]: {}", props.symbol(),
                        Instant.ofEpochMilli(windowStart), Instant.ofEpochMilli(windowEnd), e.toString());
                return Optional.empty();
            }
            windowStart = windowEnd + 1;
        }
        log.info("Fetched {} {} candles for [{}, {})", out.size(), props.symbol(), start, end);
        return Optional.of(out);
    }

    @Nullable
    private List<List<Object>> fetch(long startMs, long endMs) {
        var p = new LinkedHashMap<String, Object>();
        p.put("symbol", props.symbol());
        p.put("interval", props.interval());
        p.put("startTime", startMs);
        p.put("endTime", endMs);
        p.put("limit", props.limit());

        log.info("query binance: {} / {}", KLINES_PATH, p);
        try {
            List<List<Object>> candles = client.get()
                    .uri(u -> u.path(KLINES_PATH).queryParams(QueryParams.of(p)).build())
                    .retrieve()
                    .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class)
                            .map(body -> new IllegalStateException("Binance " + KLINES_PATH + " error " + r.statusCode().value() + ": " + body)))
                    .bodyToMono(CANDLES)
                    .block();
            return candles == null ? List.of() : candles;
        } catch (RuntimeException e) {
            log.warn("Binance klines call failed params={} error={}", p, e.toString());
            return null;
        }
    }

    private static PricePoint toPoint(List<Object> candle) {
        long openTime = ((Number) candle.get(0)).longValue();
        BigDecimal open = new BigDecimal(String.valueOf(candle.get(1)));
        return new PricePoint(openTime, open);
    }
}
