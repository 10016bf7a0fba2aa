package com.newsrank.ranking.service.ranking;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.dto.RankedArticle;
import com.newsrank.ranking.dto.RankingPreset;
import com.newsrank.ranking.dto.RankingResponse.ExcludedArticle;
import com.newsrank.ranking.dto.ScoreVector;
import com.newsrank.ranking.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 프리셋 가중 최종 점수, 정책 필터, 결정적 정렬, 소스 다양성 상한, 페이지 절단
 *
 * 정렬 순서: 최종 점수 내림차순 → 신뢰도 내림차순 → 도착 순서 오름차순
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    static final String LOW_INTEGRITY = "low_integrity";
    static final String SPAM_DETECTED = "spam_detected";
    static final String SUSPICIOUS_CREDIBILITY = "suspicious_credibility";

    static final Comparator<RankedArticle> RANKING_ORDER = Comparator
            .comparingDouble(RankedArticle::getFinalScore).reversed()
            .thenComparing(Comparator.comparingDouble((RankedArticle ranked) -> ranked.getScores().getCredibility()).reversed())
            .thenComparingInt(RankedArticle::getArrivalIndex);

    private final RankingProperties rankingProperties;

    public RankingOutcome rank(List<ScoredCandidate> candidates, RankingPreset preset, RankingOptions options) {
        RankingProperties.Policy policy = rankingProperties.getPolicy();

        List<RankedArticle> eligible = new ArrayList<>();
        List<ExcludedArticle> excluded = new ArrayList<>();
        for (ScoredCandidate candidate : candidates) {
            ScoreVector scores = candidate.scores();

            List<String> reasons = new ArrayList<>();
            if (scores.getIntegrity() < policy.getIntegrityThreshold()) {
                reasons.add(LOW_INTEGRITY);
            }
            if (scores.getSpamScore() > policy.getSpamThreshold()) {
                reasons.add(SPAM_DETECTED);
            }
            if (!reasons.isEmpty()) {
                log.debug("Policy filter excluded: id={}, reasons={}", candidate.article().getId(), reasons);
                excluded.add(new ExcludedArticle(candidate.article().getId(), candidate.article().getSourceId(),
                        reasons, scores.getIntegrity(), scores.getSpamScore()));
                continue;
            }

            List<String> policyFlags = scores.getCredibility() < policy.getCredibilityThreshold()
                    ? List.of(SUSPICIOUS_CREDIBILITY)
                    : List.of();

            eligible.add(RankedArticle.builder()
                    .article(candidate.article())
                    .scores(scores)
                    .finalScore(finalScore(scores, preset))
                    .policyFlags(policyFlags)
                    .clusterSize(candidate.clusterSize())
                    .arrivalIndex(candidate.arrivalIndex())
                    .build());
        }

        eligible.sort(RANKING_ORDER);

        List<RankedArticle> diverse = options.diversity()
                ? applyDiversityCap(eligible, options.diversityCap())
                : eligible;

        List<RankedArticle> page = paginate(diverse, options.offset(), options.limit());

        log.info("Ranking [{}]: candidates={}, excluded={}, eligible={}, diverse={}, returned={}",
                preset.name(), candidates.size(), excluded.size(), eligible.size(), diverse.size(), page.size());

        return new RankingOutcome(page, List.copyOf(excluded), eligible.size());
    }

    /**
     * 100 × 가중 합, 소수 둘째 자리 반올림, [0, 100] 제한
     */
    static double finalScore(ScoreVector scores, RankingPreset preset) {
        double raw = TextUtils.round(100.0 * preset.weightedSum(scores), 2);
        return Math.max(0.0, Math.min(100.0, raw));
    }

    /**
     * 정렬된 순서를 유지하며 소스별로 cap 개까지만 통과
     */
    static List<RankedArticle> applyDiversityCap(List<RankedArticle> sorted, int cap) {
        Map<String, Integer> perSource = new HashMap<>();
        List<RankedArticle> diverse = new ArrayList<>();
        for (RankedArticle ranked : sorted) {
            String source = Objects.toString(ranked.getArticle().getSourceId(), "");
            int count = perSource.getOrDefault(source, 0);
            if (count < cap) {
                diverse.add(ranked);
                perSource.put(source, count + 1);
            }
        }
        return diverse;
    }

    static List<RankedArticle> paginate(List<RankedArticle> ranked, int offset, int limit) {
        if (offset >= ranked.size() || limit == 0) {
            return List.of();
        }
        int end = (int) Math.min((long) offset + limit, ranked.size());
        List<RankedArticle> page = new ArrayList<>(end - offset);
        for (int i = offset; i < end; i++) {
            page.add(ranked.get(i).toBuilder().rankPosition(i + 1).build());
        }
        return page;
    }
}
