package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.event.ProgressionEvent;
import com.brandish.progression.model.ModifierConfig;
import com.brandish.progression.model.ModifierConfigJsonCodec;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.repository.ProgressionNodeRepository;
import com.brandish.progression.repository.ProgressionUnlockRepository;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves feature values through the modifiers of the nodes bound to a feature key. The
 * cache holds each feature's (config, level) list, so any base value can be resolved from it.
 */
@Service
public class ModifierService {

    private static final Logger log = LoggerFactory.getLogger(ModifierService.class);

    private static final int MAX_CACHED_FEATURES = 500;

    private final ProgressionNodeRepository progressionNodeRepository;
    private final ProgressionUnlockRepository progressionUnlockRepository;
    private final Cache<String, List<ActiveModifier>> modifierCache;
    private final AtomicLong invalidations = new AtomicLong();

    public ModifierService(
            ProgressionNodeRepository progressionNodeRepository,
            ProgressionUnlockRepository progressionUnlockRepository,
            ProgressionProperties progressionProperties
    ) {
        this.progressionNodeRepository = progressionNodeRepository;
        this.progressionUnlockRepository = progressionUnlockRepository;
        Duration ttl = progressionProperties.getModifier().getCacheTtl();
        this.modifierCache = CacheBuilder.newBuilder()
                .maximumSize(MAX_CACHED_FEATURES)
                .expireAfterWrite(ttl == null || ttl.isNegative() ? Duration.ZERO : ttl)
                .build();
    }

    /**
     * Applies every modifier bound to {@code featureKey} in tier, then id, order. Locked nodes
     * leave the value unchanged.
     */
    @Transactional(readOnly = true)
    public double getModifiedValue(String featureKey, double baseValue) {
        double value = baseValue;
        for (ActiveModifier modifier : getModifiersForFeature(featureKey)) {
            value = modifier.config().apply(value, modifier.level());
        }
        return value;
    }

    @Transactional(readOnly = true)
    public List<ActiveModifier> getModifiersForFeature(String featureKey) {
        List<ActiveModifier> cached = modifierCache.getIfPresent(featureKey);
        if (cached != null) {
            return cached;
        }

        long generation = invalidations.get();
        List<ActiveModifier> modifiers = loadModifiers(featureKey);
        modifierCache.put(featureKey, modifiers);
        if (invalidations.get() != generation) {
            // an unlock or relock landed while loading; the list may predate it
            modifierCache.invalidate(featureKey);
        }
        return modifiers;
    }

    public void invalidateAll() {
        invalidations.incrementAndGet();
        modifierCache.invalidateAll();
    }

    @EventListener
    public void onProgressionEvent(ProgressionEvent event) {
        invalidateAll();
        log.debug("Modifier cache invalidated after {} of node {} level {}", event.type(), event.nodeKey(), event.level());
    }

    private List<ActiveModifier> loadModifiers(String featureKey) {
        List<ActiveModifier> modifiers = new ArrayList<>();
        for (ProgressionNode node : progressionNodeRepository.findByModifierFeatureKey(featureKey)) {
            ModifierConfig config;
            try {
                config = ModifierConfigJsonCodec.fromJson(node.getModifierConfig());
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping unreadable modifier_config on node {}", node.getNodeKey(), ex);
                continue;
            }
            if (config == null) {
                continue;
            }
            Integer level = progressionUnlockRepository.findMaxLevelByNodeId(node.getId());
            modifiers.add(new ActiveModifier(node.getNodeKey(), config, level == null ? 0 : level));
        }
        return List.copyOf(modifiers);
    }

    public record ActiveModifier(
            String nodeKey,
            ModifierConfig config,
            int level
    ) {
    }
}
