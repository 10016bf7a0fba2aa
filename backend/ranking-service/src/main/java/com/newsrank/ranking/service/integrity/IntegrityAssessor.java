package com.newsrank.ranking.service.integrity;

import com.newsrank.ranking.dto.NormalizedArticle;
import com.newsrank.ranking.util.TextUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 기사 단위 콘텐츠 무결성 평가 (규칙 기반, 다른 기사 참조 없음)
 *
 * integrity = 0.40 × 제목-본문 일치도 + 0.30 × (1 − 토픽 오염도) + 0.30 × (1 − 스팸 점수)
 *
 * 입력 품질 문제는 예외가 아니라 플래그로 보고합니다.
 */
@Service
@Slf4j
public class IntegrityAssessor {

    static final double CONSISTENCY_WEIGHT = 0.4;
    static final double CONTAMINATION_WEIGHT = 0.3;
    static final double SPAM_WEIGHT = 0.3;

    private static final int DISPERSION_PARAGRAPHS = 5;
    private static final int CONTAMINATION_PARAGRAPHS = 10;

    private static final Pattern HANGUL_ENTITY = Pattern.compile("[가-힣]{2,}");
    private static final Pattern LATIN_ENTITY = Pattern.compile("\\b[A-Z][a-zA-Z]+\\b");
    private static final Pattern QUOTED_PHRASE = Pattern.compile("[\"“]([^\"”]{2,})[\"”]");

    private static final Set<String> STOPWORDS = Set.of(
            "의", "이", "그", "저", "것", "수", "등", "같은", "있다", "하다", "and", "the", "is");

    private static final Set<String> FUNCTION_WORDS = Set.of(
            "의", "이", "가", "을", "를", "에", "에서", "로", "과", "그리고", "또는", "있다", "하다", "되다");

    static final List<String> AD_KEYWORDS = List.of(
            "클릭", "지금구매", "할인", "특가", "무료배송", "광고", "sponsored",
            "click here", "buy now", "limited offer", "free shipping", "promoted");

    static final List<String> ILLEGAL_KEYWORDS = List.of(
            "도박", "카지노", "성인", "음란", "gambling", "casino");

    private static final List<Pattern> SENSATIONAL_TITLE_PATTERNS = List.of(
            Pattern.compile("\\[충격\\]"),
            Pattern.compile("\\[경악\\]"),
            Pattern.compile("놀라운\\s(발표|비밀|진실)"),
            Pattern.compile("\\d+번\\s(이것|저것)"),
            Pattern.compile("이\\s사실일\\s리\\s없다"));

    /**
     * 스팸 규칙 테이블 (이름 → 탐지 조건, 감점). 선언 순서대로 평가하며 합계는 1.0으로 제한합니다.
     */
    private static final List<SpamRule> SPAM_RULES = List.of(
            new SpamRule("repetitive_content", 0.3, article -> hasRepetitiveSentences(article.getBody())),
            new SpamRule("ad_content", 0.3, article -> containsAny(combinedText(article), AD_KEYWORDS)),
            new SpamRule("illegal_content", 0.5, article -> containsAny(combinedText(article), ILLEGAL_KEYWORDS)),
            new SpamRule("low_content_quality", 0.2, article -> lexicalDensity(combinedText(article)) < 0.4),
            new SpamRule("sensational_title", 0.1, article -> hasSensationalTitle(article.getTitle())));

    record SpamRule(String name, double penalty, Predicate<NormalizedArticle> detector) {
    }

    /**
     * 무결성 평가 결과
     */
    @Value
    @Builder
    public static class IntegrityReport {
        double integrity;
        double consistency;
        double contamination;
        double spam;
        @Builder.Default
        List<String> flags = List.of();
    }

    public IntegrityReport assess(NormalizedArticle article) {
        if (TextUtils.isBlank(article.getBody())) {
            log.debug("Empty body, worst-case integrity: id={}", article.getId());
            return IntegrityReport.builder()
                    .integrity(0.0)
                    .consistency(0.0)
                    .contamination(1.0)
                    .spam(1.0)
                    .flags(List.of("empty_body"))
                    .build();
        }

        List<String> flags = new ArrayList<>();

        double consistency;
        if (TextUtils.isBlank(article.getTitle())) {
            consistency = 0.0;
            flags.add("empty_title");
        } else {
            consistency = titleBodyConsistency(article.getTitle(), article.getBody());
        }

        double contamination = contamination(article.getBody(), flags);
        double spam = spam(article, flags);

        double integrity = TextUtils.clamp(
                consistency * CONSISTENCY_WEIGHT
                        + (1 - contamination) * CONTAMINATION_WEIGHT
                        + (1 - spam) * SPAM_WEIGHT);

        log.debug("Integrity: id={}, consistency={}, contamination={}, spam={} → {}",
                article.getId(), consistency, contamination, spam, integrity);

        return IntegrityReport.builder()
                .integrity(integrity)
                .consistency(consistency)
                .contamination(contamination)
                .spam(spam)
                .flags(List.copyOf(flags))
                .build();
    }

    /**
     * 제목-본문 일치도 (0~1).
     * 제목 핵심어의 본문 포함 비율에 앞 문단들의 제목 단어 집중도 감점을 적용합니다.
     */
    double titleBodyConsistency(String title, String body) {
        Set<String> entities = extractEntities(title);
        if (entities.isEmpty()) {
            return 1.0;
        }

        String bodyLower = body.toLowerCase(Locale.ROOT);
        long covered = entities.stream()
                .filter(entity -> bodyLower.contains(entity.toLowerCase(Locale.ROOT)))
                .count();
        double coverage = (double) covered / entities.size();

        Set<String> titleWords = new HashSet<>();
        for (String word : title.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 2) {
                titleWords.add(word);
            }
        }
        List<String> paragraphs = TextUtils.paragraphs(body);
        if (paragraphs.isEmpty() || titleWords.isEmpty()) {
            return coverage;
        }

        int total = 0;
        int max = 0;
        for (String paragraph : paragraphs.subList(0, Math.min(DISPERSION_PARAGRAPHS, paragraphs.size()))) {
            String paragraphLower = paragraph.toLowerCase(Locale.ROOT);
            int count = (int) titleWords.stream().filter(paragraphLower::contains).count();
            total += count;
            max = Math.max(max, count);
        }

        if (total == 0) {
            return coverage * 0.5;
        }
        double maxConcentration = (double) max / total;
        return Math.min(1.0, coverage * (1 - maxConcentration * 0.2));
    }

    static Set<String> extractEntities(String title) {
        Set<String> entities = new LinkedHashSet<>();
        collect(HANGUL_ENTITY.matcher(title), 0, entities);
        collect(LATIN_ENTITY.matcher(title), 0, entities);
        collect(QUOTED_PHRASE.matcher(title), 1, entities);
        return entities;
    }

    private static void collect(Matcher matcher, int group, Set<String> into) {
        while (matcher.find()) {
            into.add(matcher.group(group).trim());
        }
    }

    /**
     * 인접 문단 키워드 Jaccard 기반 다중 토픽 오염도 (0~1)
     */
    double contamination(String body, List<String> flags) {
        List<String> paragraphs = TextUtils.paragraphs(body);
        if (paragraphs.size() < 2) {
            return 0.0;
        }

        List<Set<String>> keywords = paragraphs.subList(0, Math.min(CONTAMINATION_PARAGRAPHS, paragraphs.size()))
                .stream()
                .map(paragraph -> TextUtils.keywords(paragraph, STOPWORDS))
                .toList();

        List<Double> similarities = new ArrayList<>();
        for (int i = 0; i < keywords.size() - 1; i++) {
            Set<String> left = keywords.get(i);
            Set<String> right = keywords.get(i + 1);
            if (left.isEmpty() && right.isEmpty()) {
                continue;
            }
            similarities.add(TextUtils.jaccard(left, right));
        }
        if (similarities.isEmpty()) {
            return 0.0;
        }

        double average = similarities.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        long lowCount = similarities.stream().filter(similarity -> similarity < 0.2).count();

        if (average < 0.3) {
            flags.add("unrelated_topics");
            return 0.7;
        }
        if (lowCount > similarities.size() * 0.5) {
            flags.add("inconsistent_topics");
            return 0.5;
        }
        return 0.0;
    }

    double spam(NormalizedArticle article, List<String> flags) {
        double score = 0.0;
        for (SpamRule rule : SPAM_RULES) {
            if (rule.detector().test(article)) {
                score += rule.penalty();
                flags.add(rule.name());
            }
        }
        return Math.min(1.0, score);
    }

    private static String combinedText(NormalizedArticle article) {
        String body = article.getBody() != null ? article.getBody() : "";
        String title = article.getTitle() != null ? article.getTitle() : "";
        return (body + " " + title).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    /**
     * 문장이 3개 이상이고 중복 문장 비율이 30%를 넘으면 반복 콘텐츠
     */
    static boolean hasRepetitiveSentences(String body) {
        List<String> sentences = TextUtils.sentences(body);
        if (sentences.size() < 3) {
            return false;
        }
        long unique = new HashSet<>(sentences).size();
        return (1 - (double) unique / sentences.size()) > 0.3;
    }

    /**
     * 기능어와 한 글자 단어를 제외한 의미 단어 비율 (단어가 없으면 1.0)
     */
    static double lexicalDensity(String text) {
        String[] words = text.trim().split("\\s+");
        if (text.isBlank() || words.length == 0) {
            return 1.0;
        }
        long meaningful = Arrays.stream(words)
                .filter(word -> !FUNCTION_WORDS.contains(word) && word.length() > 1)
                .count();
        return (double) meaningful / words.length;
    }

    static boolean hasSensationalTitle(String title) {
        if (title == null) {
            return false;
        }
        return SENSATIONAL_TITLE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(title).find());
    }
}
