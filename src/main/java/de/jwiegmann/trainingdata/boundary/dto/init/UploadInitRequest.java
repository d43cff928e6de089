package de.jwiegmann.trainingdata.boundary.dto.init;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitRequest {
    private String filename;
    private String contentType;
    private long fileSize;
    private Integer chunkSize;     // optional, sonst Default
    private String projectName;
    private ProcessingOptionsRequest processing;
}
