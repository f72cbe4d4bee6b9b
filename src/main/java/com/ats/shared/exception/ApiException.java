package com.ats.shared.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 對外可見的業務例外基底
 *
 * 子類別決定 HTTP 狀態碼，GlobalExceptionHandler 統一轉成 ErrorResponse。
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final ErrorCode code;

    protected ApiException(HttpStatus status, ErrorCode code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected ApiException(HttpStatus status, ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
