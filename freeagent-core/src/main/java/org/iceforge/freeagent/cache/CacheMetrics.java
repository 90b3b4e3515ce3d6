package org.iceforge.freeagent.cache;

public interface CacheMetrics {
    long hits();
    long misses();
    long fetchFailures();
    long invalidations();
}
