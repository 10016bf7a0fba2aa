package com.newsrank.ranking.service.ranking;

import com.newsrank.ranking.dto.RankedArticle;
import com.newsrank.ranking.dto.RankingResponse.ExcludedArticle;

import java.util.List;

/**
 * @param eligibleCount 정책 필터 통과 수
 */
public record RankingOutcome(
        List<RankedArticle> results,
        List<ExcludedArticle> excluded,
        int eligibleCount
) {
}
