package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.EngagementWeight;
import com.brandish.progression.repository.EngagementWeightRepository;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metric type weights, cached for {@code progression.engagement.weight-cache-ttl}. An empty
 * weight table falls back to the configured defaults.
 */
@Service
public class EngagementWeightService {

    /** Weight of a type missing from the table when scoring a single contribution. */
    static final double CONTRIBUTION_FALLBACK_WEIGHT = 1.0;

    /** Weight of a type missing from the table in community and user score totals. */
    static final double UNWEIGHTED_METRIC_WEIGHT = 0.0;

    private static final Logger log = LoggerFactory.getLogger(EngagementWeightService.class);

    private static final String WEIGHTS_KEY = "weights";

    private final EngagementWeightRepository engagementWeightRepository;
    private final ProgressionProperties progressionProperties;
    private final Cache<String, Map<String, Double>> weightCache;
    private final AtomicLong invalidations = new AtomicLong();

    public EngagementWeightService(
            EngagementWeightRepository engagementWeightRepository,
            ProgressionProperties progressionProperties
    ) {
        this.engagementWeightRepository = engagementWeightRepository;
        this.progressionProperties = progressionProperties;
        Duration ttl = progressionProperties.getEngagement().getWeightCacheTtl();
        this.weightCache = CacheBuilder.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl == null || ttl.isNegative() ? Duration.ZERO : ttl)
                .build();
    }

    @Transactional(readOnly = true)
    public Map<String, Double> getWeights() {
        Map<String, Double> cached = weightCache.getIfPresent(WEIGHTS_KEY);
        if (cached != null) {
            return cached;
        }

        long generation = invalidations.get();
        Map<String, Double> weights = loadWeights();
        weightCache.put(WEIGHTS_KEY, weights);
        if (invalidations.get() != generation) {
            // invalidated while loading
            weightCache.invalidate(WEIGHTS_KEY);
        }
        return weights;
    }

    /**
     * Weight used to score one contribution. Types without a row count at
     * {@value #CONTRIBUTION_FALLBACK_WEIGHT}.
     */
    public double weightFor(String metricType) {
        return getWeights().getOrDefault(metricType, CONTRIBUTION_FALLBACK_WEIGHT);
    }

    public void invalidate() {
        invalidations.incrementAndGet();
        weightCache.invalidateAll();
        log.info("Engagement weight cache invalidated");
    }

    private Map<String, Double> loadWeights() {
        List<EngagementWeight> rows = engagementWeightRepository.findAll();
        if (rows.isEmpty()) {
            log.debug("Engagement weight table is empty, using configured defaults");
            Map<String, Double> defaults = progressionProperties.getEngagement().getDefaultWeights();
            return Collections.unmodifiableMap(new LinkedHashMap<>(defaults == null ? Map.of() : defaults));
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (EngagementWeight row : rows) {
            if (row.getWeight() == null) {
                log.warn("Engagement weight for {} is null, using {}", row.getMetricType(), CONTRIBUTION_FALLBACK_WEIGHT);
                weights.put(row.getMetricType(), CONTRIBUTION_FALLBACK_WEIGHT);
                continue;
            }
            weights.put(row.getMetricType(), row.getWeight().doubleValue());
        }
        return Collections.unmodifiableMap(weights);
    }
}
