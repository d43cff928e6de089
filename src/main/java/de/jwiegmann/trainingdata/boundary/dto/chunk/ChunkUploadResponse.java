package de.jwiegmann.trainingdata.boundary.dto.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Antwort auf einen Chunk-Upload. jobId/batchProjectId sind gesetzt, sobald die Datei an die Verarbeitung übergeben wurde.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkUploadResponse {
    private String uploadId;
    private int index;
    private int received;
    private int totalChunks;
    private UploadSessionStatus status;
    private String jobId;
    private String batchProjectId;
}
