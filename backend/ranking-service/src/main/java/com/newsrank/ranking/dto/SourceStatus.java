package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsrank.ranking.entity.SourceTier;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 소스 신뢰도와 런타임 수집 상태 스냅샷
 */
@Value
@Builder
public class SourceStatus {

    @JsonProperty("source_id")
    String sourceId;

    String name;

    SourceTier tier;

    @JsonProperty("base_trust")
    double baseTrust;

    boolean active;

    @JsonProperty("consecutive_failures")
    int consecutiveFailures;

    @JsonProperty("last_crawled")
    Instant lastCrawled;

    @JsonProperty("last_success")
    Instant lastSuccess;
}
