package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 랭킹 응답: 최종 Top-N과 단계별 집계, 설명용 진단 정보
 */
@Value
@Builder
public class RankingResponse {

    String preset;

    @JsonProperty("total_input")
    int totalInput;

    @JsonProperty("after_url_dedup")
    int afterUrlDedup;

    @JsonProperty("after_title_dedup")
    int afterTitleDedup;

    /** 클러스터 대표 수 */
    @JsonProperty("after_clustering")
    int afterClustering;

    /** 정책 필터 통과 수 */
    @JsonProperty("eligible_count")
    int eligibleCount;

    @Builder.Default
    List<RankedArticle> results = List.of();

    @Builder.Default
    List<ExcludedArticle> excluded = List.of();

    @Builder.Default
    List<DedupCluster> clusters = List.of();

    /**
     * 정책 필터로 제외된 기사와 사유
     */
    public record ExcludedArticle(
            String id,
            @JsonProperty("source_id") String sourceId,
            List<String> reasons,
            double integrity,
            @JsonProperty("spam_score") double spamScore
    ) {
        public ExcludedArticle {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }
    }
}
