package com.newsrank.ranking.service.ranking;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.dto.RankedArticle;
import com.newsrank.ranking.dto.RankingPreset;
import com.newsrank.ranking.dto.RankingResponse.ExcludedArticle;
import com.newsrank.ranking.dto.ScoreVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.newsrank.ranking.support.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * RankingService 단위 테스트
 */
class RankingServiceTest {

    private static final RankingPreset QUALITY = new RankingPreset("quality", 0.15, 0.30, 0.40, 0.15);

    private RankingService rankingService;

    @BeforeEach
    void setUp() {
        rankingService = new RankingService(new RankingProperties());
    }

    @Test
    @DisplayName("quality 프리셋: popularity 0.5, relevance 0.5, quality 0.8, credibility 0.9 → 68.0")
    void finalScoreExample() {
        ScoreVector scores = scores(0.5, 0.5, 0.8, 0.9);

        assertThat(RankingService.finalScore(scores, QUALITY)).isEqualTo(68.0);
    }

    @Test
    @DisplayName("최종 점수는 0~100 범위")
    void finalScoreBounds() {
        assertThat(RankingService.finalScore(scores(1.0, 1.0, 1.0, 1.0), QUALITY)).isEqualTo(100.0);
        assertThat(RankingService.finalScore(scores(0.0, 0.0, 0.0, 0.0), QUALITY)).isZero();
    }

    @Nested
    @DisplayName("정책 필터")
    class PolicyTests {

        @Test
        @DisplayName("무결성 0.5 미만 또는 스팸 0.7 초과는 사유와 함께 제외된다")
        void excludesWithReasons() {
            // given
            List<ScoredCandidate> candidates = List.of(
                    candidate("ok", "kbs", 0, scores(0.5, 0.5, 0.5, 0.9)),
                    candidate("low", "mbc", 1, base(0.5, 0.5, 0.5, 0.9).integrity(0.49).build()),
                    candidate("spam", "sbs", 2, base(0.5, 0.5, 0.5, 0.9).spamScore(0.71).build()),
                    candidate("both", "ytn", 3, base(0.5, 0.5, 0.5, 0.9).integrity(0.1).spamScore(0.9).build()));

            // when
            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(20, 0, true, 3));

            // then
            assertThat(outcome.results()).extracting(r -> r.getArticle().getId()).containsExactly("ok");
            assertThat(outcome.eligibleCount()).isEqualTo(1);
            assertThat(outcome.excluded()).extracting(ExcludedArticle::id).containsExactly("low", "spam", "both");
            assertThat(outcome.excluded().get(0).reasons()).containsExactly("low_integrity");
            assertThat(outcome.excluded().get(1).reasons()).containsExactly("spam_detected");
            assertThat(outcome.excluded().get(2).reasons()).containsExactly("low_integrity", "spam_detected");
        }

        @Test
        @DisplayName("경계값: 무결성 0.5와 스팸 0.7은 통과한다")
        void boundaryValuesPass() {
            List<ScoredCandidate> candidates = List.of(
                    candidate("edge", "kbs", 0, base(0.5, 0.5, 0.5, 0.9).integrity(0.5).spamScore(0.7).build()));

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(20, 0, true, 3));

            assertThat(outcome.results()).hasSize(1);
            assertThat(outcome.excluded()).isEmpty();
        }

        @Test
        @DisplayName("신뢰도 0.6 미만은 제외하지 않고 suspicious_credibility 플래그만 단다")
        void flagsSuspiciousCredibility() {
            List<ScoredCandidate> candidates = List.of(candidate("weak", "blog", 0, scores(0.5, 0.5, 0.5, 0.59)));

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(20, 0, true, 3));

            assertThat(outcome.results()).hasSize(1);
            assertThat(outcome.results().get(0).getPolicyFlags()).containsExactly("suspicious_credibility");
        }
    }

    @Nested
    @DisplayName("결정적 정렬")
    class OrderingTests {

        @Test
        @DisplayName("최종 점수가 같으면 신뢰도가 높은 기사가 앞선다")
        void tieBreakByCredibility() {
            // 둘 다 최종 점수 33.5
            List<ScoredCandidate> candidates = List.of(
                    candidate("lowCred", "kbs", 0, scores(0.0, 0.0, 0.6125, 0.6)),
                    candidate("highCred", "mbc", 1, scores(0.0, 0.0, 0.5, 0.9)));

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(20, 0, true, 3));

            assertThat(outcome.results()).extracting(RankedArticle::getFinalScore).containsOnly(33.5);
            assertThat(outcome.results()).extracting(r -> r.getArticle().getId()).containsExactly("highCred", "lowCred");
        }

        @Test
        @DisplayName("점수와 신뢰도가 모두 같으면 먼저 도착한 기사가 앞선다")
        void tieBreakByArrival() {
            List<ScoredCandidate> candidates = List.of(
                    candidate("later", "kbs", 7, scores(0.5, 0.5, 0.5, 0.8)),
                    candidate("earlier", "mbc", 3, scores(0.5, 0.5, 0.5, 0.8)));

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(20, 0, true, 3));

            assertThat(outcome.results()).extracting(r -> r.getArticle().getId()).containsExactly("earlier", "later");
        }
    }

    @Nested
    @DisplayName("소스 다양성")
    class DiversityTests {

        @Test
        @DisplayName("같은 소스 6건이 상위권이어도 상한 3건만 남고 다른 소스가 빈자리를 채운다")
        void sixFromSameSource() {
            // given
            List<ScoredCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                candidates.add(candidate("kbs-" + i, "kbs", i, scores(0.9 - i * 0.01, 0.9, 0.9, 0.9)));
            }
            candidates.add(candidate("mbc-0", "mbc", 6, scores(0.3, 0.3, 0.6, 0.8)));
            candidates.add(candidate("sbs-0", "sbs", 7, scores(0.2, 0.3, 0.6, 0.8)));
            candidates.add(candidate("ytn-0", "ytn", 8, scores(0.1, 0.3, 0.6, 0.8)));

            // when
            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(6, 0, true, 3));

            // then
            assertThat(outcome.results()).extracting(r -> r.getArticle().getId())
                    .containsExactly("kbs-0", "kbs-1", "kbs-2", "mbc-0", "sbs-0", "ytn-0");
            assertThat(outcome.results()).extracting(RankedArticle::getRankPosition)
                    .containsExactly(1, 2, 3, 4, 5, 6);
        }

        @Test
        @DisplayName("diversity=false 이면 상한을 적용하지 않는다")
        void diversityDisabled() {
            List<ScoredCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                candidates.add(candidate("kbs-" + i, "kbs", i, scores(0.9 - i * 0.01, 0.9, 0.9, 0.9)));
            }
            candidates.add(candidate("mbc-0", "mbc", 6, scores(0.3, 0.3, 0.6, 0.8)));

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(6, 0, false, 3));

            assertThat(outcome.results()).extracting(r -> r.getArticle().getSourceId()).containsOnly("kbs");
        }

        @Test
        @DisplayName("상한 0이면 아무것도 통과하지 않는다")
        void zeroCap() {
            RankingOutcome outcome = rankingService.rank(
                    List.of(candidate("a", "kbs", 0, scores(0.5, 0.5, 0.5, 0.9))), QUALITY, options(20, 0, true, 0));

            assertThat(outcome.results()).isEmpty();
            assertThat(outcome.eligibleCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("페이지 절단")
    class PagingTests {

        @Test
        @DisplayName("offset 이후 limit 만큼 반환하고 순위는 전체 기준")
        void offsetAndLimit() {
            List<ScoredCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                candidates.add(candidate("a" + i, "src" + i, i, scores(0.9 - i * 0.1, 0.5, 0.5, 0.9)));
            }

            RankingOutcome outcome = rankingService.rank(candidates, QUALITY, options(2, 2, true, 3));

            assertThat(outcome.results()).extracting(r -> r.getArticle().getId()).containsExactly("a2", "a3");
            assertThat(outcome.results()).extracting(RankedArticle::getRankPosition).containsExactly(3, 4);
        }

        @Test
        @DisplayName("limit 0 또는 범위를 벗어난 offset은 빈 결과")
        void emptyPages() {
            List<ScoredCandidate> candidates = List.of(candidate("a", "kbs", 0, scores(0.5, 0.5, 0.5, 0.9)));

            assertThat(rankingService.rank(candidates, QUALITY, options(0, 0, true, 3)).results()).isEmpty();
            assertThat(rankingService.rank(candidates, QUALITY, options(10, 5, true, 3)).results()).isEmpty();
        }
    }

    private static RankingOptions options(int limit, int offset, boolean diversity, int cap) {
        return new RankingOptions(limit, offset, diversity, cap);
    }

    private static ScoredCandidate candidate(String id, String source, int arrival, ScoreVector scores) {
        return new ScoredCandidate(article(id, source, "제목 " + id, "본문"), scores, arrival, 1);
    }

    private static ScoreVector scores(double popularity, double relevance, double quality, double credibility) {
        return base(popularity, relevance, quality, credibility).build();
    }

    private static ScoreVector.ScoreVectorBuilder base(double popularity, double relevance,
                                                       double quality, double credibility) {
        return ScoreVector.builder()
                .integrity(0.9)
                .spamScore(0.0)
                .popularity(popularity)
                .relevance(relevance)
                .quality(quality)
                .credibility(credibility);
    }
}
