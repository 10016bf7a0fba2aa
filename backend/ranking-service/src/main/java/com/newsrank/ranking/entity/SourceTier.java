package com.newsrank.ranking.entity;

/**
 * Trust tier of a news source.
 *
 * - WHITELIST: Verified primary sources (wire services, official agencies)
 * - TIER1: Major national media
 * - TIER2: Regional / specialized media
 * - TIER3: Low-verification outlets, aggregators, blogs
 * - BLACKLIST: Known spam or fabricated-content sources
 */
public enum SourceTier {
    WHITELIST("whitelist", "화이트리스트"),
    TIER1("tier1", "1등급"),
    TIER2("tier2", "2등급"),
    TIER3("tier3", "3등급"),
    BLACKLIST("blacklist", "블랙리스트");

    private final String value;
    private final String label;

    SourceTier(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Check if this tier counts as a verified source.
     */
    public boolean isVerified() {
        return this == WHITELIST || this == TIER1;
    }
}
