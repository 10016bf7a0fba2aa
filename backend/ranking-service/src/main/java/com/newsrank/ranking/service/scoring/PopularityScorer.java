package com.newsrank.ranking.service.scoring;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.util.TextUtils;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 조회/공유/댓글 기반 인기도와 트렌딩 속도
 *
 * 참여 지표가 하나라도 있으면 배치 최댓값 대비 정규화한 가중 합을,
 * 없으면 발행 시각 기준 반감기 신선도를 사용합니다.
 */
@Service
@RequiredArgsConstructor
public class PopularityScorer {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final RankingProperties rankingProperties;

    @Value
    @Builder
    public static class PopularityReport {
        double popularity;
        double trendingVelocity;
        boolean engagementBased;
    }

    /**
     * @param articles 점수를 매길 배치 (정규화 최댓값도 이 배치에서 계산)
     * @param now      호출 단위로 고정된 기준 시각
     */
    public List<PopularityReport> score(List<NormalizedArticle> articles, Instant now) {
        long maxViews = articles.stream().mapToLong(NormalizedArticle::views).max().orElse(0);
        long maxShares = articles.stream().mapToLong(NormalizedArticle::shares).max().orElse(0);
        long maxComments = articles.stream().mapToLong(NormalizedArticle::comments).max().orElse(0);

        RankingProperties.Popularity config = rankingProperties.getPopularity();
        List<PopularityReport> reports = new ArrayList<>(articles.size());
        for (NormalizedArticle article : articles) {
            double popularity;
            boolean engagementBased = article.hasEngagement();
            if (engagementBased) {
                popularity = config.getViewWeight() * ratio(article.views(), maxViews)
                        + config.getShareWeight() * ratio(article.shares(), maxShares)
                        + config.getCommentWeight() * ratio(article.comments(), maxComments);
            } else {
                popularity = freshness(article.getPublishedAt(), now);
            }
            reports.add(PopularityReport.builder()
                    .popularity(TextUtils.clamp(popularity))
                    .trendingVelocity(trendingVelocity(article, now))
                    .engagementBased(engagementBased)
                    .build());
        }
        return reports;
    }

    /**
     * 0.5^(경과 시간 / 반감기), 발행 시각이 없으면 기본값. 미래 시각은 경과 0으로 취급합니다.
     */
    double freshness(Instant publishedAt, Instant now) {
        if (publishedAt == null) {
            return rankingProperties.getPopularity().getUnknownPublishScore();
        }
        double hours = hoursSince(publishedAt, now);
        return Math.pow(0.5, hours / rankingProperties.getPopularity().getFreshnessHalfLifeHours());
    }

    /**
     * (조회 + 3×공유 + 2×댓글) / max(경과 시간, ε) / 정규화 상수
     */
    double trendingVelocity(NormalizedArticle article, Instant now) {
        if (article.getPublishedAt() == null) {
            return 0.0;
        }
        RankingProperties.Popularity config = rankingProperties.getPopularity();
        double hours = Math.max(config.getVelocityMinHours(), hoursSince(article.getPublishedAt(), now));
        double engagement = article.views() + 3.0 * article.shares() + 2.0 * article.comments();
        if (engagement == 0) {
            return 0.0;
        }
        return TextUtils.clamp(engagement / hours / config.getVelocityNormalizer());
    }

    private static double ratio(long value, long max) {
        return max > 0 ? (double) value / max : 0.0;
    }

    private static double hoursSince(Instant publishedAt, Instant now) {
        return Math.max(0.0, Duration.between(publishedAt, now).toMillis() / 1000.0 / SECONDS_PER_HOUR);
    }
}
