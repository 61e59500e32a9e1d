package com.brandish.progression.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Progression engine tuning. Every value here has a product-facing effect on unlock pacing,
 * so defaults mirror the live tree and can be overridden per environment.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "progression")
public class ProgressionProperties {

    private Engagement engagement = new Engagement();
    private Voting voting = new Voting();
    private Unlock unlock = new Unlock();
    private Cost cost = new Cost();
    private Modifier modifier = new Modifier();
    private Tree tree = new Tree();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Engagement {
        private Duration weightCacheTtl = Duration.ofMinutes(5);
        private int leaderboardDefaultLimit = 10;
        private int leaderboardMaxLimit = 100;

        /**
         * Used when the engagement_weights table has no rows.
         */
        private Map<String, Double> defaultWeights = defaultWeights();

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put("message", 1.0);
            weights.put("command", 2.0);
            weights.put("item_crafted", 3.0);
            weights.put("item_used", 1.5);
            return weights;
        }
    }

    @Getter
    @Setter
    public static class Voting {
        private int maxOptions = 4;
        private Duration sessionDuration = Duration.ofHours(24);
        private boolean deadlineCheckEnabled = true;
        private long deadlineCheckIntervalMs = 60_000;
        private long deadlineCheckInitialDelayMs = 30_000;
    }

    @Getter
    @Setter
    public static class Unlock {
        private int maxRolloverPoints = 200;
        private String rootNodeKey = "progression_system";
        private String contributionBoostKey = "upgrade_contribution_boost";
        private int contributionBoostNumerator = 3;
        private int contributionBoostDenominator = 2;
        private String progressionRateFeatureKey = "progression_rate";
    }

    @Getter
    @Setter
    public static class Cost {
        private int baseSmall = 500;
        private int baseMedium = 1000;
        private int baseLarge = 2000;
        private double tierScalingFactor = 1.5;
    }

    @Getter
    @Setter
    public static class Modifier {
        private Duration cacheTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Tree {
        private String configPath = "classpath:progression/progression_tree.json";
        private boolean syncOnStartup = true;
    }

    @Getter
    @Setter
    public static class Events {
        private String sinkMode = "log";
        private String redisListKey = "progression:events";
    }
}
