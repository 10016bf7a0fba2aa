package com.newsrank.ranking.service.scoring;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.service.scoring.PopularityScorer.PopularityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.newsrank.ranking.support.TestArticles.builder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * PopularityScorer 단위 테스트
 */
class PopularityScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private PopularityScorer popularityScorer;

    @BeforeEach
    void setUp() {
        popularityScorer = new PopularityScorer(new RankingProperties());
    }

    @Nested
    @DisplayName("참여 지표 기반 인기도")
    class EngagementTests {

        @Test
        @DisplayName("배치 최댓값 대비 0.40/0.35/0.25 가중 합")
        void normalizedByBatchMax() {
            // given
            NormalizedArticle top = builder("a", "kbs").viewCount(1000L).shareCount(100L).commentCount(50L).build();
            NormalizedArticle half = builder("b", "mbc").viewCount(500L).shareCount(0L).commentCount(0L).build();

            // when
            List<PopularityReport> reports = popularityScorer.score(List.of(top, half), NOW);

            // then
            assertThat(reports.get(0).getPopularity()).isCloseTo(1.0, within(1e-9));
            assertThat(reports.get(1).getPopularity()).isCloseTo(0.2, within(1e-9));
            assertThat(reports).allMatch(PopularityReport::isEngagementBased);
        }

        @Test
        @DisplayName("최댓값이 0인 지표는 0으로 취급한다")
        void zeroMaxRatio() {
            NormalizedArticle commentsOnly = builder("a", "kbs").commentCount(10L).build();

            List<PopularityReport> reports = popularityScorer.score(List.of(commentsOnly), NOW);

            assertThat(reports.get(0).getPopularity()).isCloseTo(0.25, within(1e-9));
        }
    }

    @Nested
    @DisplayName("신선도 기반 인기도")
    class FreshnessTests {

        @Test
        @DisplayName("24시간 반감기로 감쇠한다")
        void halfLife() {
            assertThat(popularityScorer.freshness(NOW.minus(Duration.ofHours(24)), NOW)).isCloseTo(0.5, within(1e-9));
            assertThat(popularityScorer.freshness(NOW.minus(Duration.ofHours(48)), NOW)).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("발행 시각이 없으면 0.3")
        void unknownPublishTime() {
            NormalizedArticle undated = builder("a", "kbs").build();

            List<PopularityReport> reports = popularityScorer.score(List.of(undated), NOW);

            assertThat(reports.get(0).getPopularity()).isEqualTo(0.3);
            assertThat(reports.get(0).isEngagementBased()).isFalse();
        }

        @Test
        @DisplayName("미래 발행 시각은 경과 0시간으로 취급한다")
        void futurePublishTime() {
            assertThat(popularityScorer.freshness(NOW.plus(Duration.ofHours(3)), NOW)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("트렌딩 속도")
    class VelocityTests {

        @Test
        @DisplayName("(조회 + 3×공유 + 2×댓글) / 경과 시간 / 10000")
        void velocity() {
            NormalizedArticle article = builder("a", "kbs")
                    .publishedAt(NOW.minus(Duration.ofHours(2)))
                    .viewCount(4000L).shareCount(1000L).commentCount(1500L)
                    .build();

            assertThat(popularityScorer.trendingVelocity(article, NOW)).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("경과 시간은 최소 1시간으로 본다")
        void minimumOneHour() {
            NormalizedArticle article = builder("a", "kbs")
                    .publishedAt(NOW.minus(Duration.ofMinutes(10)))
                    .viewCount(5000L)
                    .build();

            assertThat(popularityScorer.trendingVelocity(article, NOW)).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("발행 시각이 없으면 0, 상한은 1.0")
        void boundaries() {
            NormalizedArticle undated = builder("a", "kbs").viewCount(1_000_000L).build();
            NormalizedArticle viral = builder("b", "kbs")
                    .publishedAt(NOW.minus(Duration.ofHours(1)))
                    .viewCount(1_000_000L)
                    .build();

            assertThat(popularityScorer.trendingVelocity(undated, NOW)).isZero();
            assertThat(popularityScorer.trendingVelocity(viral, NOW)).isEqualTo(1.0);
        }
    }
}
