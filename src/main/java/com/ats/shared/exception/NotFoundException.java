package com.ats.shared.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

    public NotFoundException(ErrorCode code, String message) {
        super(HttpStatus.NOT_FOUND, code, message);
    }

    public NotFoundException(ErrorCode code, String message, Throwable cause) {
        super(HttpStatus.NOT_FOUND, code, message, cause);
    }
}
