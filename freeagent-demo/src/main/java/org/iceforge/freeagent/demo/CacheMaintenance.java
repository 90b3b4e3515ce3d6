package org.iceforge.freeagent.demo;

import org.iceforge.freeagent.cache.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Expired entries are otherwise only dropped when read; this sweeps the ones nobody asks for again. */
@Component
public class CacheMaintenance {
    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenance.class);

    private final CacheStore store;

    public CacheMaintenance(CacheStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${freeagent.cache.purge-interval:PT1M}")
    public void scheduledPurge() {
        purgeExpired();
    }

    public int purgeExpired() {
        int purged = store.purgeExpired();
        if (purged > 0) {
            logger.info("Purged {} expired FreeAgent cache entries, {} remain", purged, store.size());
        } else {
            logger.debug("No expired FreeAgent cache entries");
        }
        return purged;
    }
}
