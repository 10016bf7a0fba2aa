package com.newsrank.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 기사별 점수 벡터 (모든 점수 0~1)
 *
 * 무결성/신뢰도·품질/인기도 단계가 각자 만든 결과를 파이프라인이 한 번에 합쳐 생성하며,
 * 생성 이후에는 변경되지 않습니다.
 */
@Value
@Builder
public class ScoreVector {

    // 무결성
    double integrity;
    @JsonProperty("title_body_consistency")
    double titleBodyConsistency;
    @JsonProperty("contamination_score")
    double contaminationScore;
    @JsonProperty("spam_score")
    double spamScore;

    // 신뢰도
    double credibility;
    @JsonProperty("source_trust")
    double sourceTrust;
    @JsonProperty("cross_source_bonus")
    double crossSourceBonus;
    @JsonProperty("corroboration_count")
    int corroborationCount;

    // 품질
    double quality;
    @JsonProperty("evidence_score")
    double evidenceScore;
    @JsonProperty("sensationalism_penalty")
    double sensationalismPenalty;

    // 관련성 (키워드 미지정 시 quality와 동일)
    double relevance;

    // 인기도
    double popularity;
    @JsonProperty("trending_velocity")
    double trendingVelocity;
    /** 참여 지표 기반이면 true, 신선도 감쇠 기반이면 false */
    @JsonProperty("engagement_based")
    boolean engagementBased;

    /**
     * 진단 플래그 (스팸 탐지기, 미등록 소스 등)
     */
    @Builder.Default
    List<String> flags = List.of();
}
