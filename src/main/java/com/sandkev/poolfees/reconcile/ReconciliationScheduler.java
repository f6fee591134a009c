package com.sandkev.poolfees.reconcile;

import com.sandkev.poolfees.config.SchedulingConfig;
import com.sandkev.poolfees.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the engine: backfill once the application is up, then the two steady-state activities.
 * Each method here is a recovery boundary; a failed run is logged and the next one goes ahead.
 *
 * <p>On context close the backfill thread is interrupted so it stops at its next pause or upstream call
 * instead of holding up the executor's shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private final ReconciliationEngine engine;
    private final TrackerProperties props;

    private volatile boolean stopped;
    @Nullable
    private volatile Thread backfillThread;

    @Async(SchedulingConfig.BACKFILL_EXECUTOR)
    @EventListener(ApplicationReadyEvent.class)
    public void startBackfill() {
        backfillThread = Thread.currentThread();
        try {
            if (!runBackfill()) return;
        } finally {
            backfillThread = null;
        }
        // the backfill may have crossed a UTC midnight
        refreshPrice();
    }

    /** @return false if stopped before the engine became ready */
    private boolean runBackfill() {
        while (!stopped && !engine.isReady()) {
            try {
                engine.backfill();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Backfill cancelled");
                return false;
            } catch (RuntimeException e) {
                if (stopped) break;
                log.error("Backfill failed, retrying in {}: {}", props.backfillRetryDelay(), e.getMessage(), e);
                try {
                    RateLimit.beforeCall(props.backfillRetryDelay());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.info("Backfill cancelled");
                    return false;
                }
            }
        }
        if (stopped) {
            log.info("Backfill cancelled");
            return false;
        }
        return true;
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        stopped = true;
        Thread t = backfillThread;
        if (t != null) {
            log.info("Stopping backfill on {}", t.getName());
            t.interrupt();
        }
    }

    @Scheduled(fixedDelayString = "${tracker.poll-delay:PT10S}")
    public void pollTransactions() {
        if (stopped || !engine.isReady()) return;
        try {
            engine.pollTransactions();
        } catch (Exception e) {
            log.error("Unable to poll transactions due to {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${tracker.price-refresh-cron:1 0 0 * * *}", zone = "UTC")
    public void refreshPrice() {
        if (stopped || !engine.isReady()) return;
        try {
            engine.refreshPrice();
        } catch (Exception e) {
            log.error("Unable to get ETH prices due to {}", e.getMessage(), e);
        }
    }
}
