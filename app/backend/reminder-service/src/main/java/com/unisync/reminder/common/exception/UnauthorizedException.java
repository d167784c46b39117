package com.unisync.reminder.common.exception;

/**
 * 요청자를 식별할 수 없는 요청에 대한 예외 (X-User-Id 누락 또는 형식 오류)
 */
public class UnauthorizedException extends RuntimeException {

    private final String errorCode;

    public UnauthorizedException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public UnauthorizedException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
