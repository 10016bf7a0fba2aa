package com.newsrank.ranking.config;

import com.newsrank.ranking.exception.RankingConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the deduplication and ranking pipeline.
 *
 * All scores handled by the pipeline are in [0, 1]; the final score is scaled to [0, 100].
 * Presets are validated when the configuration is loaded: every weight must be
 * non-negative and the four weights must sum to 1.0.
 */
@Configuration
@ConfigurationProperties(prefix = "newsrank.ranking")
@Data
@Slf4j
public class RankingProperties {

    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private Dedup dedup = new Dedup();

    private Corroboration corroboration = new Corroboration();

    private Popularity popularity = new Popularity();

    private Policy policy = new Policy();

    private Defaults defaults = new Defaults();

    /**
     * Named weight vectors (preset name → weights)
     */
    private Map<String, PresetWeights> presets = defaultPresets();

    @Data
    public static class Dedup {
        /** Title Jaccard similarity at or above which two articles are one cluster */
        private double similarityThreshold = 0.6;

        /** Below this many Stage-B survivors the similarity matrix is computed on the caller thread */
        private int parallelMinArticles = 64;
    }

    @Data
    public static class Corroboration {
        /** Title Jaccard similarity for an independent source to count as corroboration */
        private double similarityThreshold = 0.5;

        /** Titles with fewer tokens never receive a bonus */
        private int minTitleTokens = 3;

        private double minorBonus = 0.05;

        private double majorBonus = 0.15;

        /** Corroborating articles needed for the major bonus */
        private int majorMinCount = 3;
    }

    @Data
    public static class Popularity {
        private double viewWeight = 0.40;
        private double shareWeight = 0.35;
        private double commentWeight = 0.25;

        /** Freshness half-life in hours */
        private double freshnessHalfLifeHours = 24.0;

        /** Score used when neither engagement nor publish time is known */
        private double unknownPublishScore = 0.3;

        /** Lower bound for hours-since-publish in the velocity denominator */
        private double velocityMinHours = 1.0;

        /** Engagement units per hour that map to velocity 1.0 */
        private double velocityNormalizer = 10_000.0;
    }

    @Data
    public static class Policy {
        /** Exclude below */
        private double integrityThreshold = 0.5;

        /** Exclude above */
        private double spamThreshold = 0.7;

        /** Flag below */
        private double credibilityThreshold = 0.6;
    }

    @Data
    public static class Defaults {
        private String preset = "quality";
        private int limit = 20;
        private int offset = 0;
        private int diversityCap = 3;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PresetWeights {
        private double popularity;
        private double relevance;
        private double quality;
        private double credibility;

        public double sum() {
            return popularity + relevance + quality + credibility;
        }
    }

    private static Map<String, PresetWeights> defaultPresets() {
        Map<String, PresetWeights> presets = new LinkedHashMap<>();
        presets.put("quality", new PresetWeights(0.15, 0.30, 0.40, 0.15));
        presets.put("trending", new PresetWeights(0.50, 0.10, 0.20, 0.20));
        presets.put("credible", new PresetWeights(0.10, 0.20, 0.20, 0.50));
        presets.put("latest", new PresetWeights(0.10, 0.20, 0.30, 0.40));
        return presets;
    }

    /**
     * 설정 로드 시 프리셋 가중치 검증
     */
    @PostConstruct
    public void validate() {
        if (presets == null || presets.isEmpty()) {
            throw new RankingConfigurationException("At least one ranking preset must be configured");
        }
        for (Map.Entry<String, PresetWeights> entry : presets.entrySet()) {
            String name = entry.getKey();
            PresetWeights weights = entry.getValue();
            requireNonNegative(name, "popularity", weights.getPopularity());
            requireNonNegative(name, "relevance", weights.getRelevance());
            requireNonNegative(name, "quality", weights.getQuality());
            requireNonNegative(name, "credibility", weights.getCredibility());

            double sum = weights.sum();
            if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
                throw RankingConfigurationException.presetWeightSum(name, sum);
            }
        }
        if (defaults.getPreset() != null && !presets.containsKey(defaults.getPreset())) {
            throw new RankingConfigurationException(
                    "Default preset '" + defaults.getPreset() + "' is not configured");
        }
        log.info("Loaded {} ranking presets: {}", presets.size(), presets.keySet());
    }

    private static void requireNonNegative(String preset, String component, double value) {
        if (value < 0) {
            throw RankingConfigurationException.negativeWeight(preset, component, value);
        }
    }
}
