package com.my.sion.domain.exception;

/**
 * 왜: 호출자가 계약을 위반했을 때(알 수 없는 기간 종류, 범위 밖 월 등) 사용자 입력 오류와 구분해 명확히 실패를 알리기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
