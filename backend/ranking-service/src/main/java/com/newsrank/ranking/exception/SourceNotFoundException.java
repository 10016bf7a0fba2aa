package com.newsrank.ranking.exception;

/**
 * 레지스트리에 등록되지 않은 소스
 */
public class SourceNotFoundException extends RankingException {

    private final String sourceId;

    public SourceNotFoundException(String sourceId) {
        super("SOURCE_NOT_FOUND", "Source not registered: " + sourceId);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
