package com.newsrank.ranking.service.ranking;

import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.dto.ScoreVector;

/**
 * 점수 벡터가 결합된 클러스터 대표 (랭커 입력)
 */
public record ScoredCandidate(
        NormalizedArticle article,
        ScoreVector scores,
        int arrivalIndex,
        int clusterSize
) {
}
