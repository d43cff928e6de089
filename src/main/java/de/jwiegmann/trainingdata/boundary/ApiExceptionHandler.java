package de.jwiegmann.trainingdata.boundary;

import de.jwiegmann.trainingdata.boundary.dto.error.UploadError;
import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.control.exception.ApiException;
import de.jwiegmann.trainingdata.control.exception.ErrorCode;
import de.jwiegmann.trainingdata.control.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Übersetzt Fehler aus Services und Auth-Interceptor in den einheitlichen UploadError-Body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<UploadError> handleApiException(ApiException e) {
        log.debug("Request rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(e.getErrorCode().getHttpStatus()).body(UploadErrorFactory.toError(e));
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<UploadError> handleInfrastructureException(InfrastructureException e) {
        log.error("Infrastructure failure while handling request", e);
        return ResponseEntity.status(ErrorCode.INFRASTRUCTURE_ERROR.getHttpStatus()).body(UploadErrorFactory.toError(e));
    }

    // Bindungsfehler von Spring MVC im selben Format wie eigene Validierungsfehler
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MaxUploadSizeExceededException.class
    })
    public ResponseEntity<UploadError> handleBindingException(Exception e) {
        return handleApiException(UploadErrorFactory.validationFailed(e.getMessage()));
    }
}
