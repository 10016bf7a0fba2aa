package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 소스 레지스트리 통계
 *
 * @param active   활성 소스 수 (블랙리스트 제외)
 * @param verified 활성 검증 소스 수 (whitelist + tier1)
 * @param byTier   Tier별 전체 소스 수
 */
public record SourceRegistryStats(
        int total,
        int active,
        int verified,
        @JsonProperty("by_tier") Map<String, Long> byTier
) {
    public SourceRegistryStats {
        byTier = byTier == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byTier));
    }
}
