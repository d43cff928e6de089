package de.jwiegmann.trainingdata.boundary.dto.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fortschritt einer Upload-Session inkl. fehlender Chunk-Indizes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadStatusResponse {

    private String uploadId;
    private String filename;
    private UploadSessionStatus status;
    private boolean finalized;
    private int received;
    private int totalChunks;

    @JsonProperty("missingChunks")
    private List<Integer> missingChunks;

    private String jobId;
    private String batchProjectId;
}
