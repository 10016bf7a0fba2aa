package com.newsrank.ranking.exception;

/**
 * 랭킹 서비스 관련 예외 기본 클래스
 */
public class RankingException extends RuntimeException {

    private final String errorCode;

    public RankingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RankingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
