package com.newsrank.ranking.exception;

/**
 * 설정 로드 시점의 오류 (잘못된 프리셋 가중치, 티어 신뢰도 범위 등)
 */
public class RankingConfigurationException extends RankingException {

    public RankingConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }

    /**
     * 프리셋 가중치 합이 1.0이 아님
     */
    public static RankingConfigurationException presetWeightSum(String preset, double sum) {
        return new RankingConfigurationException(
                "Preset '" + preset + "' weights must sum to 1.0 but sum to " + sum);
    }

    /**
     * 음수 가중치
     */
    public static RankingConfigurationException negativeWeight(String preset, String component, double value) {
        return new RankingConfigurationException(
                "Preset '" + preset + "' has negative " + component + " weight: " + value);
    }
}
