package com.newsrank.ranking.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only trust view of one source, as answered by the registry.
 */
public record SourceTrust(
        @JsonProperty("source_id") String sourceId,
        SourceTier tier,
        @JsonProperty("base_trust") double baseTrust
) {
}
