package com.sandkev.poolfees.reconcile;

import com.sandkev.poolfees.chain.BlockchainClient;
import com.sandkev.poolfees.chain.ChainTransaction;
import com.sandkev.poolfees.config.TrackerProperties;
import com.sandkev.poolfees.fee.FeeCache;
import com.sandkev.poolfees.fee.FeeCalculator;
import com.sandkev.poolfees.fee.FeeDataException;
import com.sandkev.poolfees.fee.PriceState;
import com.sandkev.poolfees.fee.StalePriceException;
import com.sandkev.poolfees.price.PriceClient;
import com.sandkev.poolfees.price.PricePoint;
import com.sandkev.poolfees.price.PriceSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Joins gas paid (from the block indexer) with the ETH/USD price (from the price feed) into
 * {@link FeeCache}.
 *
 * <p>Starts in {@link Phase#BACKFILLING}: {@link #backfill()} replays the pool's history, pricing every
 * transaction at the daily price in effect at its timestamp. Once it returns the engine is in
 * {@link Phase#STEADY_STATE}, where {@link #pollTransactions()} prices new blocks at the single cached
 * price and {@link #refreshPrice()} rolls that price forward once a day.
 *
 * <p>The cursor is the highest block whose transactions are all in the cache; each block is fetched
 * once in steady state (from {@code cursor + 1}). A transfer in the latest block that the indexer had not
 * yet indexed when that block was fetched is therefore never picked up.
 *
 * <p>{@link #refreshPrice()} is serialized: the post-backfill run and the daily cron run may overlap.
 */
@Slf4j
@Service
public class ReconciliationEngine {

    public enum Phase { BACKFILLING, STEADY_STATE }

    private final BlockchainClient chain;
    private final PriceClient prices;
    private final FeeCache cache;
    private final FeeCalculator calculator;
    private final TrackerProperties props;
    private final Clock clock;

    private volatile Phase phase = Phase.BACKFILLING;

    public ReconciliationEngine(BlockchainClient chain,
                                PriceClient prices,
                                FeeCache cache,
                                FeeCalculator calculator,
                                TrackerProperties props,
                                Clock clock) {
        this.chain = chain;
        this.prices = prices;
        this.cache = cache;
        this.calculator = calculator;
        this.props = props;
        this.clock = clock;
    }

    /* -------------------- backfill -------------------- */

    /**
     * Catches the cache up to the latest block. Safe to call again after a failure: it resumes from
     * the current cursor.
     *
     * @throws BackfillException if the latest block, the price history or a batch cannot be fetched
     * @throws FeeDataException  if a historical transaction cannot be priced
     * @throws InterruptedException if cancelled while pausing between batches
     */
    public void backfill() throws InterruptedException {
        log.info("Backfill start cursor={}", cache.cursor());
        long latest = chain.latestBlock()
                .orElseThrow(() -> new BackfillException("Could not get latest block"));

        Instant historyStart = props.historyStart().atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant now = clock.instant();
        PriceSeries series = new PriceSeries(prices.priceSeries(historyStart, now)
                .orElseThrow(() -> new BackfillException("Could not get prices for [" + historyStart + ", " + now + ")")));
        if (series.isEmpty()) {
            throw new BackfillException("No prices for [" + historyStart + ", " + now + ")");
        }
        log.info("Backfilling to block {} with {} daily prices", latest, series.size());

        int failures = 0;
        while (cache.cursor() < latest) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Backfill interrupted at cursor " + cache.cursor());
            }
            long cursor = cache.cursor();
            Optional<List<ChainTransaction>> batch = chain.historicalTransactions(cursor + 1, latest);
            if (batch.isEmpty()) {
                if (++failures >= props.backfillMaxAttempts()) {
                    throw new BackfillException("Gave up fetching blocks [" + (cursor + 1) + ", " + latest
                            + "] after " + failures + " attempts");
                }
                log.warn("No batch for blocks [{}, {}], attempt {}/{}", cursor + 1, latest, failures, props.backfillMaxAttempts());
                RateLimit.beforeCall(props.backfillPause());
                continue;
            }
            failures = 0;

            List<ChainTransaction> txs = batch.get();
            Map<String, BigDecimal> fees = new LinkedHashMap<>();
            long maxBlock = cursor;
            for (ChainTransaction tx : txs) {
                Instant ts = Instant.ofEpochSecond(tx.timestamp());
                PricePoint price = series.at(ts)
                        .orElseThrow(() -> new FeeDataException("No price at or before " + ts + " for transaction " + tx.hash()));
                fees.put(tx.hash(), calculator.feeUsd(tx, price.price()));
                maxBlock = Math.max(maxBlock, tx.blockNumber());
            }
            long next = nextBackfillCursor(cursor, latest, txs.size(), maxBlock);
            cache.commit(fees, next);
            log.info("Backfilled {} transactions, cursor {} -> {} (target {})", txs.size(), cursor, next, latest);

            if (next < latest) {
                RateLimit.beforeCall(props.backfillPause()); // upstream rate limit
            }
        }

        PricePoint last = series.latest().orElseThrow();
        cache.updatePrice(new PriceState(last.price(), last.timestamp()));
        phase = Phase.STEADY_STATE;
        log.info("Backfill done cursor={} fees={} price={} asOf={}", cache.cursor(), cache.size(), last.price(), last.timestamp());
    }

    private long nextBackfillCursor(long cursor, long latest, int batchSize, long maxBlock) {
        if (batchSize < chain.pageSize()) {
            return latest; // short page: nothing else up to latest
        }
        // full page: the highest block may continue on the next page
        if (maxBlock - 1 > cursor) {
            return maxBlock - 1;
        }
        log.warn("Block {} alone fills a page of {} transactions; the rest of that block is not tracked", maxBlock, batchSize);
        return maxBlock;
    }

    /* -------------------- steady state -------------------- */

    /**
     * One polling tick. All-or-nothing: either every transaction of the batch is stored and the cursor
     * moves to the latest block, or nothing changes.
     *
     * @throws FeeDataException    on a null hash or a non-integer gas field
     * @throws StalePriceException if the cached price is too old for a transaction
     */
    public void pollTransactions() {
        OptionalLong latestBlock = chain.latestBlock();
        if (latestBlock.isEmpty()) {
            log.error("Could not get latest block");
            return;
        }
        long latest = latestBlock.getAsLong();
        long cursor = cache.cursor();
        if (latest <= cursor) {
            log.debug("No new blocks latest={} cursor={}", latest, cursor);
            return;
        }

        log.info("Polling transactions... latest_block={}, latest_block_seen={}", latest, cursor);
        Optional<List<ChainTransaction>> batch = chain.historicalTransactions(cursor + 1, latest);
        if (batch.isEmpty()) {
            log.warn("Could not get transactions for blocks [{}, {}]", cursor + 1, latest);
            return;
        }
        List<ChainTransaction> txs = batch.get();
        if (txs.size() >= chain.pageSize()) {
            log.warn("Page full ({} transactions) for blocks [{}, {}]; later transactions in the range are not tracked",
                    txs.size(), cursor + 1, latest);
        }

        PriceState price = cache.priceState().orElse(null);
        Map<String, BigDecimal> staged = new LinkedHashMap<>();
        for (ChainTransaction tx : txs) {
            if (price == null) {
                throw new StalePriceException("No price recorded yet; cannot price transaction " + tx.hash());
            }
            BigDecimal fee = calculator.feeUsd(tx, price.price());
            Instant ts = Instant.ofEpochSecond(tx.timestamp());
            if (price.isStaleFor(ts, props.maxPriceAge())) {
                throw new StalePriceException("Stale ETH price: as of " + price.asOf() + ", transaction " + tx.hash() + " at " + ts);
            }
            staged.put(tx.hash(), fee);
        }
        cache.commit(staged, latest);
        log.info("Stored {} fees, cursor {} -> {}", staged.size(), cursor, latest);
    }

    /**
     * Rolls the cached price forward when it is more than a day old. The new price is the last daily
     * candle up to now and is recorded as of the start of the current UTC day.
     */
    public synchronized void refreshPrice() {
        PriceState current = cache.priceState()
                .orElseThrow(() -> new PriceFeedException("No price to refresh; backfill has not completed"));
        Instant now = clock.instant();
        if (!now.isAfter(current.asOf().plus(props.maxPriceAge()))) {
            log.debug("Price as of {} is current", current.asOf());
            return;
        }

        List<PricePoint> points = prices.priceSeries(current.asOf(), now)
                .orElseThrow(() -> new PriceFeedException("Could not get prices for [" + current.asOf() + ", " + now + ")"));
        PricePoint last = new PriceSeries(points).latest()
                .orElseThrow(() -> new PriceFeedException("No candles for [" + current.asOf() + ", " + now + ")"));

        Instant startOfDay = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
        cache.updatePrice(new PriceState(last.price(), startOfDay));
        log.info("Price updated {} -> {} as of {}", current.price(), last.price(), startOfDay);
    }

    public Phase phase() {
        return phase;
    }

    public boolean isReady() {
        return phase == Phase.STEADY_STATE;
    }
}
