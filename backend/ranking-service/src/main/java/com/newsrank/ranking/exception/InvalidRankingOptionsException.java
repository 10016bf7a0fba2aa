package com.newsrank.ranking.exception;

/**
 * 호출 시점의 랭킹 옵션 오류 (임계값 범위, 음수 limit/offset/cap 등)
 */
public class InvalidRankingOptionsException extends RankingException {

    public InvalidRankingOptionsException(String message) {
        super("INVALID_OPTIONS", message);
    }

    public static InvalidRankingOptionsException thresholdOutOfRange(String name, double value) {
        return new InvalidRankingOptionsException(name + " must be within [0, 1]: " + value);
    }

    public static InvalidRankingOptionsException negative(String name, int value) {
        return new InvalidRankingOptionsException(name + " must not be negative: " + value);
    }
}
