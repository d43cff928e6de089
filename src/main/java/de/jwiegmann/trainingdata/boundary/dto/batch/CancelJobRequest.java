package de.jwiegmann.trainingdata.boundary.dto.batch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelJobRequest {
    private String jobId;
    private String userId;
}
