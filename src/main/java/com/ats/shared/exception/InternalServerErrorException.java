package com.ats.shared.exception;

import org.springframework.http.HttpStatus;

public class InternalServerErrorException extends ApiException {

    public InternalServerErrorException(ErrorCode code, String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, message);
    }

    public InternalServerErrorException(ErrorCode code, String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, message, cause);
    }
}
