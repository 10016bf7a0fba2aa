package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 랭킹 최종 결과 항목
 */
@Value
@Builder(toBuilder = true)
public class RankedArticle {

    NormalizedArticle article;

    ScoreVector scores;

    /** 0 ~ 100 */
    @JsonProperty("final_score")
    double finalScore;

    /** 1부터 시작하는 최종 순위 */
    @JsonProperty("rank_position")
    int rankPosition;

    /** 제외 사유가 아닌 경고 플래그 */
    @JsonProperty("policy_flags")
    @Builder.Default
    List<String> policyFlags = List.of();

    @JsonProperty("cluster_size")
    int clusterSize;

    /** 입력 배치에서의 도착 순서 (0부터) */
    @JsonProperty("arrival_index")
    int arrivalIndex;
}
