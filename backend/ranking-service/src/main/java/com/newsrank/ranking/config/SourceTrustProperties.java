package com.newsrank.ranking.config;

import com.newsrank.ranking.entity.SourceTier;
import com.newsrank.ranking.exception.RankingConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for externalized source trust.
 *
 * Trust values range from 0.0 to 1.0 where:
 * - 0.95 : whitelist (wire services, official agencies)
 * - 0.85 : tier1 (major national media)
 * - 0.65 : tier2 (regional / specialized media)
 * - 0.40 : tier3 (unverified outlets; also the fallback for unknown sources)
 * - 0.00 : blacklist
 *
 * A registered source may override its tier value with an explicit base trust.
 */
@Configuration
@ConfigurationProperties(prefix = "newsrank.sources")
@Data
public class SourceTrustProperties {

    /**
     * Base trust per tier
     */
    private TierTrust tiers = new TierTrust();

    /**
     * Registered sources (source id → definition)
     */
    private Map<String, SourceDefinition> registry = new LinkedHashMap<>();

    /**
     * Consecutive collection failures before a source is deactivated
     */
    private int maxConsecutiveFailures = 5;

    @Data
    public static class TierTrust {
        private double whitelist = 0.95;
        private double tier1 = 0.85;
        private double tier2 = 0.65;
        private double tier3 = 0.40;
        private double blacklist = 0.0;
    }

    @Data
    public static class SourceDefinition {
        private String name;

        private SourceTier tier = SourceTier.TIER2;

        /** Overrides the tier value when set */
        private Double baseTrust;

        private boolean active = true;
    }

    /**
     * Get the configured trust value of a tier.
     */
    public double getTrustForTier(SourceTier tier) {
        if (tier == null) return tiers.tier3;
        return switch (tier) {
            case WHITELIST -> tiers.whitelist;
            case TIER1 -> tiers.tier1;
            case TIER2 -> tiers.tier2;
            case TIER3 -> tiers.tier3;
            case BLACKLIST -> tiers.blacklist;
        };
    }

    public Map<SourceTier, Double> tierTable() {
        Map<SourceTier, Double> table = new EnumMap<>(SourceTier.class);
        for (SourceTier tier : SourceTier.values()) {
            table.put(tier, getTrustForTier(tier));
        }
        return table;
    }

    @PostConstruct
    public void validate() {
        for (Map.Entry<SourceTier, Double> entry : tierTable().entrySet()) {
            requireUnitInterval("tier " + entry.getKey().getValue(), entry.getValue());
        }
        registry.forEach((id, definition) -> {
            if (definition.getBaseTrust() != null) {
                requireUnitInterval("source " + id, definition.getBaseTrust());
            }
        });
        if (maxConsecutiveFailures < 1) {
            throw new RankingConfigurationException(
                    "maxConsecutiveFailures must be at least 1: " + maxConsecutiveFailures);
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new RankingConfigurationException(name + " trust must be within [0, 1]: " + value);
        }
    }
}
