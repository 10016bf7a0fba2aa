package com.newsrank.ranking.dto;

/**
 * 이름이 붙은 랭킹 가중치 벡터
 */
public record RankingPreset(
        String name,
        double popularity,
        double relevance,
        double quality,
        double credibility
) {

    /**
     * 가중 합 (0~1 범위의 점수에 대해 0~1)
     */
    public double weightedSum(ScoreVector scores) {
        return scores.getPopularity() * popularity
                + scores.getRelevance() * relevance
                + scores.getQuality() * quality
                + scores.getCredibility() * credibility;
    }
}
