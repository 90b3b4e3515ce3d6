package org.iceforge.freeagent.demo.api;

import org.iceforge.freeagent.cache.CacheMetricsRegistry;
import org.iceforge.freeagent.cache.CacheStore;
import org.iceforge.freeagent.client.FreeAgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class CacheStatsController {
    private static final Logger logger = LoggerFactory.getLogger(CacheStatsController.class);

    private final CacheMetricsRegistry metrics;
    private final CacheStore store;
    private final FreeAgentProperties props;

    public CacheStatsController(CacheMetricsRegistry metrics, CacheStore store, FreeAgentProperties props) {
        this.metrics = Objects.requireNonNull(metrics);
        this.store = Objects.requireNonNull(store);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hits", metrics.hits());
        out.put("misses", metrics.misses());
        out.put("hitRatio", metrics.hitRatio());
        out.put("fetchFailures", metrics.fetchFailures());
        out.put("invalidations", metrics.invalidations());
        out.put("entries", store.size());

        out.put("enabled", props.getCache().isEnabled());
        out.put("ttl", String.valueOf(props.getCache().getTtl()));
        out.put("apiBaseUrl", props.resolvedApiBaseUrl());
        return out;
    }

    @PostMapping("/cache/purge")
    public Map<String, Object> purge() {
        int purged = store.purgeExpired();
        return Map.of("purged", purged, "entries", store.size());
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clear() {
        int before = store.size();
        store.clear();
        logger.info("FreeAgent cache cleared ({} entries)", before);
        return Map.of("cleared", before);
    }
}
