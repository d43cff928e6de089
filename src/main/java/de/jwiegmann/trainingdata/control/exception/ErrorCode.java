package de.jwiegmann.trainingdata.control.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CHUNK_OUT_OF_RANGE(HttpStatus.BAD_REQUEST),
    CHUNK_SIZE_MISMATCH(HttpStatus.BAD_REQUEST),
    CHUNK_CONFLICT(HttpStatus.CONFLICT),
    UPLOAD_INCOMPLETE(HttpStatus.CONFLICT),
    UPLOAD_ALREADY_FINALIZED(HttpStatus.CONFLICT),
    UPLOAD_EXPIRED(HttpStatus.GONE),
    JOB_NOT_FINISHED(HttpStatus.CONFLICT),
    INFRASTRUCTURE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
