package de.jwiegmann.trainingdata.boundary.dto.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.trainingdata.entity.Job;
import de.jwiegmann.trainingdata.entity.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Status-Antwort für das Polling eines Batch-Jobs. Liefert immer den aktuellen Teilfortschritt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private String jobId;
    private String batchProjectId;
    private String projectName;
    private JobStatus status;
    private boolean cancelRequested;
    private String error;

    private int totalDocuments;
    private int completedDocuments;
    private int progress;   // Prozent 0..100
    private int totalRecords;

    private Instant createdAt;
    private Instant finishedAt;

    private List<DocumentStatusResponse> documents;

    public static JobStatusResponse of(Job job) {
        int total = job.getDocuments().size();
        int completed = job.getCompletedCount();
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .batchProjectId(job.getBatchProjectId())
                .projectName(job.getProjectName())
                .status(job.getStatus())
                .cancelRequested(job.isCancelRequested())
                .error(job.getError())
                .totalDocuments(total)
                .completedDocuments(completed)
                .progress(total == 0 ? 100 : completed * 100 / total)
                .totalRecords(job.getTotalRecords())
                .createdAt(job.getCreatedAt())
                .finishedAt(job.getFinishedAt())
                .documents(job.getDocuments().stream().map(DocumentStatusResponse::of).toList())
                .build();
    }
}
