package de.jwiegmann.trainingdata.control.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Fehler, der synchron an den aufrufenden Client zurückgegeben wird.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public ApiException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : details;
    }

    public ApiException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }
}
