package com.newsrank.ranking.exception;

import java.util.Collection;

/**
 * 등록되지 않은 랭킹 프리셋 요청
 */
public class UnknownPresetException extends RankingException {

    private final String presetName;

    public UnknownPresetException(String presetName, Collection<String> knownPresets) {
        super("UNKNOWN_PRESET", "Unknown ranking preset: '" + presetName + "' (known: " + knownPresets + ")");
        this.presetName = presetName;
    }

    public String getPresetName() {
        return presetName;
    }
}
