package com.sandkev.poolfees.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.Duration;
import java.time.LocalDate;

@ConfigurationProperties("tracker")
public record TrackerProperties(
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        LocalDate historyStart,      // first day of the price series used by backfill
        Duration  pollDelay,         // steady-state transaction polling period
        Duration  backfillPause,     // pause between backfill batches
        int       backfillMaxAttempts,
        Duration  backfillRetryDelay,
        Duration  maxPriceAge,       // a price older than this (vs. the tx timestamp) is stale
        String    priceRefreshCron
) {}
