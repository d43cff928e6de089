package de.jwiegmann.trainingdata.boundary.dto.init;

import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitResponse {
    private String uploadId;
    private UploadSessionStatus status;
    private int chunkSize;
    private int totalChunks;
    private Instant createdAt;
    private Instant expiresAt;   // verschiebt sich mit jeder Aktivität
}
