package com.newsrank.ranking.service.scoring;

import com.newsrank.ranking.config.RankingProperties;
import com.newsrank.ranking.config.SourceTrustProperties;
import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.entity.SourceTier;
import com.newsrank.ranking.entity.SourceTrust;
import com.newsrank.ranking.service.dedup.DeduplicationResult.Representative;
import com.newsrank.ranking.service.dedup.SimilarityGraph;
import com.newsrank.ranking.service.registry.SourceTrustLookup;
import com.newsrank.ranking.util.TextUtils;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 소스 신뢰도 + 교차 소스 보도 보너스
 *
 * credibility = clamp(source_trust + cross_source_bonus)
 *
 * 교차 소스 보너스는 다른 소스의 클러스터 대표 중 제목 유사도가 임계값 이상인 기사 수로 결정합니다.
 * 1~2건이면 소폭, 3건 이상이면 대폭 가산합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredibilityScorer {

    private final SourceTrustLookup sourceTrustLookup;
    private final SourceTrustProperties sourceTrustProperties;
    private final RankingProperties rankingProperties;

    @Value
    @Builder
    public static class CredibilityReport {
        double credibility;
        double sourceTrust;
        double crossSourceBonus;
        int corroborationCount;
        @Builder.Default
        List<String> flags = List.of();
    }

    /**
     * 대표 기사 전체의 신뢰도 (입력과 같은 순서)
     *
     * @param representatives        클러스터 대표
     * @param graph                  대표들이 속한 유사도 그래프
     * @param corroborationThreshold 교차 보도 판정 임계값 (포함)
     */
    public List<CredibilityReport> score(List<Representative> representatives,
                                         SimilarityGraph graph,
                                         double corroborationThreshold) {
        Map<Integer, Integer> representativeByNode = new HashMap<>();
        for (int i = 0; i < representatives.size(); i++) {
            representativeByNode.put(representatives.get(i).survivorIndex(), i);
        }

        List<CredibilityReport> reports = new ArrayList<>(representatives.size());
        for (Representative representative : representatives) {
            int count = corroborationCount(representative, representatives, representativeByNode,
                    graph, corroborationThreshold);
            reports.add(buildReport(representative.article(), count));
        }
        return reports;
    }

    CredibilityReport buildReport(NormalizedArticle article, int corroborationCount) {
        List<String> flags = new ArrayList<>();
        double trust = sourceTrust(article.getSourceId(), flags);
        double bonus = crossSourceBonus(corroborationCount);
        return CredibilityReport.builder()
                .credibility(TextUtils.clamp(trust + bonus))
                .sourceTrust(trust)
                .crossSourceBonus(bonus)
                .corroborationCount(corroborationCount)
                .flags(List.copyOf(flags))
                .build();
    }

    /**
     * 등록 소스는 레지스트리 값, 미등록 소스는 tier3 값 + unknown_source 플래그
     */
    double sourceTrust(String sourceId, List<String> flags) {
        Optional<SourceTrust> trust = sourceTrustLookup.find(sourceId);
        if (trust.isPresent()) {
            return trust.get().baseTrust();
        }
        log.debug("Unknown source, falling back to tier3 trust: {}", sourceId);
        flags.add("unknown_source");
        return sourceTrustProperties.getTrustForTier(SourceTier.TIER3);
    }

    double crossSourceBonus(int corroborationCount) {
        RankingProperties.Corroboration config = rankingProperties.getCorroboration();
        if (corroborationCount >= config.getMajorMinCount()) {
            return config.getMajorBonus();
        }
        if (corroborationCount >= 1) {
            return config.getMinorBonus();
        }
        return 0.0;
    }

    private int corroborationCount(Representative representative,
                                   List<Representative> representatives,
                                   Map<Integer, Integer> representativeByNode,
                                   SimilarityGraph graph,
                                   double threshold) {
        NormalizedArticle article = representative.article();
        if (TextUtils.tokenSet(article.getTitle()).size() < rankingProperties.getCorroboration().getMinTitleTokens()) {
            return 0;
        }

        int count = 0;
        for (int neighbor : graph.neighbors(representative.survivorIndex(), threshold)) {
            Integer other = representativeByNode.get(neighbor);
            if (other == null) {
                continue;
            }
            NormalizedArticle otherArticle = representatives.get(other).article();
            if (Objects.equals(otherArticle.getId(), article.getId())
                    || Objects.equals(otherArticle.getSourceId(), article.getSourceId())) {
                continue;
            }
            count++;
        }
        return count;
    }
}
