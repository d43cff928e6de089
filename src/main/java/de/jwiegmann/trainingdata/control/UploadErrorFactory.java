package de.jwiegmann.trainingdata.control;

import de.jwiegmann.trainingdata.boundary.dto.error.UploadError;
import de.jwiegmann.trainingdata.control.exception.ApiException;
import de.jwiegmann.trainingdata.control.exception.ErrorCode;
import de.jwiegmann.trainingdata.control.exception.InfrastructureException;

import java.util.Map;

/**
 * Zentrale Stelle für Fehlercodes und -texte, damit Controller und Services dieselben Meldungen liefern.
 */
public final class UploadErrorFactory {

    private UploadErrorFactory() {
    }

    public static UploadError toError(ApiException e) {
        return UploadError.builder()
                .code(e.getErrorCode().name())
                .message(e.getMessage())
                .details(e.getDetails())
                .build();
    }

    public static UploadError toError(InfrastructureException e) {
        return UploadError.builder()
                .code(ErrorCode.INFRASTRUCTURE_ERROR.name())
                .message(e.getMessage())
                .details(Map.of())
                .build();
    }

    public static ApiException validationFailed(String details) {
        return new ApiException(ErrorCode.VALIDATION_FAILED,
                "Request validation failed: " + details,
                Map.of("details", details));
    }

    public static ApiException unsupportedContentType(String contentType) {
        return new ApiException(ErrorCode.VALIDATION_FAILED,
                "unsupported content type",
                Map.of("contentType", String.valueOf(contentType)));
    }

    public static ApiException unauthorized() {
        return new ApiException(ErrorCode.UNAUTHORIZED, "missing or invalid bearer credential");
    }

    public static ApiException forbidden(String userId) {
        return new ApiException(ErrorCode.FORBIDDEN,
                "credential does not grant access to this user",
                Map.of("userId", userId));
    }

    public static ApiException uploadNotFound(String uploadId) {
        return new ApiException(ErrorCode.NOT_FOUND, "uploadId not found", Map.of("uploadId", uploadId));
    }

    public static ApiException jobNotFound(String jobId) {
        return new ApiException(ErrorCode.NOT_FOUND, "jobId not found", Map.of("jobId", jobId));
    }

    public static ApiException batchProjectNotFound(String batchProjectId) {
        return new ApiException(ErrorCode.NOT_FOUND,
                "batchProjectId not found",
                Map.of("batchProjectId", batchProjectId));
    }

    public static ApiException chunkOutOfRange(int index, int totalChunks) {
        return new ApiException(ErrorCode.CHUNK_OUT_OF_RANGE,
                "chunk index out of range (0.." + (totalChunks - 1) + ")",
                Map.of("index", index, "totalChunks", totalChunks));
    }

    public static ApiException chunkSizeMismatch(int index, long expected, int actual) {
        return new ApiException(ErrorCode.CHUNK_SIZE_MISMATCH,
                "chunk length does not match the declared size",
                Map.of("index", index, "expected", expected, "actual", actual));
    }

    public static ApiException chunkConflict(int index, int recordedLength, int actual) {
        return new ApiException(ErrorCode.CHUNK_CONFLICT,
                "chunk already received with different content",
                Map.of("index", index, "recordedLength", recordedLength, "actual", actual));
    }

    public static ApiException uploadIncomplete(String uploadId, int received, int totalChunks) {
        return new ApiException(ErrorCode.UPLOAD_INCOMPLETE,
                "not all chunks have been uploaded",
                Map.of("uploadId", uploadId, "received", received, "totalChunks", totalChunks));
    }

    public static ApiException uploadAlreadyFinalized(String uploadId) {
        return new ApiException(ErrorCode.UPLOAD_ALREADY_FINALIZED,
                "upload already finalized",
                Map.of("uploadId", uploadId));
    }

    public static ApiException uploadExpired(String uploadId) {
        return new ApiException(ErrorCode.UPLOAD_EXPIRED, "upload session expired", Map.of("uploadId", uploadId));
    }

    public static ApiException jobNotFinished(String jobId) {
        return new ApiException(ErrorCode.JOB_NOT_FINISHED, "job is still running", Map.of("jobId", jobId));
    }
}
