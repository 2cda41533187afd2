package com.my.sion.domain.exception;

/**
 * 왜: 외부 분류기(LLM) 결과가 유효하지 않을 때 명시적으로 실패를 표현해 규칙 기반 폴백으로 넘어가게 하기 위함.
 */
public class IntentParseException extends RuntimeException {
    public IntentParseException(String message) {
        super(message);
    }

    public IntentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
