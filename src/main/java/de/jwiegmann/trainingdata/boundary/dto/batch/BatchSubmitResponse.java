package de.jwiegmann.trainingdata.boundary.dto.batch;

import de.jwiegmann.trainingdata.entity.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmitResponse {
    private String jobId;
    private String batchProjectId;
    private JobStatus status;
    private int documents;
}
