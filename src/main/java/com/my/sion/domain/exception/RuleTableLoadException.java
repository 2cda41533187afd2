package com.my.sion.domain.exception;

/**
 * 왜: 규칙 테이블을 읽지 못한 상태로 기동하면 모든 분류가 조용히 틀어지므로 시작 시점에 바로 실패시키기 위함.
 */
public class RuleTableLoadException extends RuntimeException {
    public RuleTableLoadException(String message) {
        super(message);
    }

    public RuleTableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
