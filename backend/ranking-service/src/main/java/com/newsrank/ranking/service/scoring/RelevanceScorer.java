package com.newsrank.ranking.service.scoring;

import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.util.TextUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 키워드 기반 품질 보정 관련성
 *
 * relevance = coverage × (0.5 + 0.5 × quality), coverage = 0.6 × 제목 포함률 + 0.4 × 본문 포함률
 * 키워드가 없으면 quality 를 그대로 사용합니다.
 */
@Service
public class RelevanceScorer {

    private static final double TITLE_WEIGHT = 0.6;
    private static final double BODY_WEIGHT = 0.4;

    public double score(NormalizedArticle article, double quality, List<String> keywords) {
        Set<String> normalized = normalizeKeywords(keywords);
        if (normalized.isEmpty()) {
            return quality;
        }

        String title = article.getTitle() != null ? article.getTitle().toLowerCase(Locale.ROOT) : "";
        String body = article.getBody() != null ? article.getBody().toLowerCase(Locale.ROOT) : "";

        double titleCoverage = (double) normalized.stream().filter(title::contains).count() / normalized.size();
        double bodyCoverage = (double) normalized.stream().filter(body::contains).count() / normalized.size();
        double coverage = TITLE_WEIGHT * titleCoverage + BODY_WEIGHT * bodyCoverage;

        return TextUtils.clamp(coverage * (0.5 + 0.5 * quality));
    }

    static Set<String> normalizeKeywords(List<String> keywords) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keywords == null) {
            return normalized;
        }
        for (String keyword : keywords) {
            if (!TextUtils.isBlank(keyword)) {
                normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
