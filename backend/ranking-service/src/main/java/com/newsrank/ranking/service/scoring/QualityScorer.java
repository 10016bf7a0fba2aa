package com.newsrank.ranking.service.scoring;

import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.util.TextUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 근거 기반 품질 점수
 *
 * quality = clamp(evidence − sensationalism)
 * evidence = Σ(충족한 근거 규칙 가중치) + min(0.2, 본문 길이 / 5000)
 */
@Service
@Slf4j
public class QualityScorer {

    private static final double LENGTH_BONUS_CAP = 0.2;
    private static final double LENGTH_BONUS_DIVISOR = 5000.0;

    private static final double SENSATIONAL_WORD_PENALTY = 0.15;
    private static final double SENSATIONAL_WORD_CAP = 0.5;
    private static final double PUNCTUATION_PENALTY = 0.1;
    private static final double PUNCTUATION_CAP = 0.2;

    private static final Pattern STATISTICS = Pattern.compile("\\d+(%|억|만|조)");
    private static final Pattern QUOTATION = Pattern.compile("\"[^\"]{5,}\"|'[^']{5,}'|“[^”]{5,}”");
    private static final Pattern OFFICIAL_STATEMENT = Pattern.compile("관계자는?\\s|대변인");
    private static final Pattern REPORT_REFERENCE = Pattern.compile("보고서|연구\\s결과|발표\\s자료");
    private static final Pattern PLAIN_LINK = Pattern.compile("https?://\\S+");
    private static final Pattern EXCESSIVE_PUNCTUATION = Pattern.compile("[!?]{2,}|[ㅋㅎ]{2,}");

    static final List<String> SENSATIONAL_WORDS = List.of(
            "충격", "경악", "발칵", "폭탄", "대박", "역대급", "초대형",
            "긴급", "속보", "단독", "breaking", "shock");

    /**
     * 근거 규칙 테이블 (이름, 가중치, 탐지 조건)
     */
    private static final List<EvidenceRule> EVIDENCE_RULES = List.of(
            new EvidenceRule("statistics", 0.20, body -> STATISTICS.matcher(body).find()),
            new EvidenceRule("quotation", 0.20, body -> QUOTATION.matcher(body).find()),
            new EvidenceRule("official_statement", 0.15, body -> OFFICIAL_STATEMENT.matcher(body).find()),
            new EvidenceRule("report_reference", 0.15, body -> REPORT_REFERENCE.matcher(body).find()),
            new EvidenceRule("reference_link", 0.10, QualityScorer::hasReferenceLink));

    record EvidenceRule(String name, double weight, Predicate<String> detector) {
    }

    @Value
    @Builder
    public static class QualityReport {
        double quality;
        double evidence;
        double sensationalism;
        @Builder.Default
        List<String> flags = List.of();
    }

    public QualityReport score(NormalizedArticle article) {
        List<String> flags = new ArrayList<>();
        double evidence = evidenceScore(article.getBody(), flags);
        double sensationalism = sensationalismPenalty(article.getTitle());
        return QualityReport.builder()
                .quality(TextUtils.clamp(evidence - sensationalism))
                .evidence(evidence)
                .sensationalism(sensationalism)
                .flags(List.copyOf(flags))
                .build();
    }

    double evidenceScore(String body, List<String> flags) {
        if (TextUtils.isBlank(body)) {
            flags.add("no_evidence_body");
            return 0.0;
        }
        double score = 0.0;
        for (EvidenceRule rule : EVIDENCE_RULES) {
            if (rule.detector().test(body)) {
                score += rule.weight();
            }
        }
        score += Math.min(LENGTH_BONUS_CAP, body.length() / LENGTH_BONUS_DIVISOR);
        return TextUtils.clamp(score);
    }

    double sensationalismPenalty(String title) {
        if (TextUtils.isBlank(title)) {
            return 0.0;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        long words = SENSATIONAL_WORDS.stream().filter(lower::contains).count();
        double penalty = Math.min(SENSATIONAL_WORD_CAP, words * SENSATIONAL_WORD_PENALTY);

        Matcher matcher = EXCESSIVE_PUNCTUATION.matcher(title);
        int punctuation = 0;
        while (matcher.find()) {
            punctuation++;
        }
        penalty += Math.min(PUNCTUATION_CAP, punctuation * PUNCTUATION_PENALTY);
        return TextUtils.clamp(penalty);
    }

    /**
     * 일반 텍스트 URL 또는 HTML 앵커의 외부 링크
     */
    static boolean hasReferenceLink(String body) {
        if (PLAIN_LINK.matcher(body).find()) {
            return true;
        }
        if (body.indexOf('<') < 0) {
            return false;
        }
        for (Element anchor : Jsoup.parse(body).select("a[href]")) {
            String href = anchor.attr("href").toLowerCase(Locale.ROOT);
            if (href.startsWith("http://") || href.startsWith("https://") || href.startsWith("//")) {
                return true;
            }
        }
        return false;
    }
}
