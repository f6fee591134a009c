package com.sandkev.poolfees.price;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ascending price points with "price in effect at" lookup.
 */
public final class PriceSeries {

    private final List<PricePoint> points;

    public PriceSeries(List<PricePoint> points) {
        this.points = List.copyOf(points);
    }

    /**
     * Latest point whose timestamp is at or before {@code at}. An exact match wins;
     * otherwise the closest point strictly before. Empty if {@code at} precedes the whole series.
     */
    public Optional<PricePoint> at(Instant at) {
        long target = at.toEpochMilli();
        int lo = 0;
        int hi = points.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (points.get(mid).timestampMillis() <= target) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found < 0 ? Optional.empty() : Optional.of(points.get(found));
    }

    public Optional<PricePoint> latest() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }
}
