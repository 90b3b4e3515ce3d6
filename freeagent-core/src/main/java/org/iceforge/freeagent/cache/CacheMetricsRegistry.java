package org.iceforge.freeagent.cache;

import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory counters shared by every {@link ResourceCache} of a client.
 * <p>
 * {@code invalidations} counts keys removed after successful mutations, whether or not an entry was present.
 */
public class CacheMetricsRegistry implements CacheMetrics {
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder fetchFailures = new LongAdder();
    private final LongAdder invalidations = new LongAdder();

    public void recordHit() { hits.increment(); }
    public void recordMiss() { misses.increment(); }
    public void recordFetchFailure() { fetchFailures.increment(); }
    public void recordInvalidations(int keys) { if (keys > 0) invalidations.add(keys); }

    @Override public long hits() { return hits.sum(); }
    @Override public long misses() { return misses.sum(); }
    @Override public long fetchFailures() { return fetchFailures.sum(); }
    @Override public long invalidations() { return invalidations.sum(); }

    /** hits / (hits + misses), 0 when nothing was read yet. */
    public double hitRatio() {
        long h = hits();
        long total = h + misses();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public void reset() {
        hits.reset();
        misses.reset();
        fetchFailures.reset();
        invalidations.reset();
    }
}
