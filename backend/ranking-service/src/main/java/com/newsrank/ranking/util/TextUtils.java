package com.newsrank.ranking.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 제목/본문 토큰화 및 Jaccard 유사도 공용 유틸리티
 */
public final class TextUtils {

    private static final String WHITESPACE = "\\s+";

    private TextUtils() {
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /**
     * 제목 정규화: 앞뒤 공백 제거, 연속 공백 축약, 소문자화
     */
    public static String normalizeTitle(String title) {
        if (isBlank(title)) {
            return "";
        }
        return title.trim().replaceAll(WHITESPACE, " ").toLowerCase(Locale.ROOT);
    }

    /**
     * 공백 기준 토큰 집합 (소문자)
     */
    public static Set<String> tokenSet(String text) {
        if (isBlank(text)) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split(WHITESPACE))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Jaccard 유사도 |A∩B| / |A∪B|, 한쪽이라도 비어 있으면 0
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    public static double jaccard(String a, String b) {
        return jaccard(tokenSet(a), tokenSet(b));
    }

    /**
     * 줄바꿈 기준 문단 (빈 문단 제외)
     */
    public static List<String> paragraphs(String body) {
        if (isBlank(body)) {
            return List.of();
        }
        return Arrays.stream(body.split("\\r?\\n"))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    /**
     * 문장 분리 (마침표/물음표/느낌표)
     */
    public static List<String> sentences(String body) {
        if (isBlank(body)) {
            return List.of();
        }
        return Arrays.stream(body.split("[.!?。]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * 불용어를 제외한 3자 이상 키워드 집합
     */
    public static Set<String> keywords(String text, Set<String> stopwords) {
        if (isBlank(text)) {
            return Set.of();
        }
        Set<String> keywords = new HashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split(WHITESPACE)) {
            if (word.length() > 2 && !stopwords.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
