package com.newsrank.ranking.service.ranking;

/**
 * 검증이 끝난 호출 단위 랭킹 옵션
 *
 * @param diversity    false 이면 소스별 상한을 적용하지 않음
 * @param diversityCap 소스별 최대 노출 수
 */
public record RankingOptions(
        int limit,
        int offset,
        boolean diversity,
        int diversityCap
) {
}
