package com.sandkev.poolfees.reconcile;

import java.time.Duration;

public final class RateLimit {
    private RateLimit() {}

    /** Pause before the next upstream call. Interruption means the caller is being shut down. */
    public static void beforeCall(Duration pause) throws InterruptedException {
        if (pause != null && !pause.isNegative() && !pause.isZero()) Thread.sleep(pause.toMillis());
    }
}
