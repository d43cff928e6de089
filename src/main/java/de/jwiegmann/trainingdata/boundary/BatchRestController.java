package de.jwiegmann.trainingdata.boundary;

import de.jwiegmann.trainingdata.boundary.auth.BearerAuthInterceptor;
import de.jwiegmann.trainingdata.boundary.dto.batch.BatchSubmitResponse;
import de.jwiegmann.trainingdata.boundary.dto.batch.CancelJobRequest;
import de.jwiegmann.trainingdata.boundary.dto.status.JobStatusListResponse;
import de.jwiegmann.trainingdata.boundary.dto.status.JobStatusResponse;
import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.control.batch.BatchOrchestrator;
import de.jwiegmann.trainingdata.control.batch.InMemoryDocumentSource;
import de.jwiegmann.trainingdata.control.batch.JobStatusStore;
import de.jwiegmann.trainingdata.control.exception.InfrastructureException;
import de.jwiegmann.trainingdata.control.processing.ProcessingOptionsResolver;
import de.jwiegmann.trainingdata.control.processing.RecordFormatter;
import de.jwiegmann.trainingdata.entity.Job;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.TrainingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch-Verarbeitung mehrerer Dateien in einem Request; Fortschritt wird über /process-status gepollt.
 */
@Slf4j
@RestController
public class BatchRestController {

    private final BatchOrchestrator batchOrchestrator;
    private final JobStatusStore jobStatusStore;
    private final ProcessingOptionsResolver optionsResolver;
    private final RecordFormatter recordFormatter;

    public BatchRestController(BatchOrchestrator batchOrchestrator,
                               JobStatusStore jobStatusStore,
                               ProcessingOptionsResolver optionsResolver,
                               RecordFormatter recordFormatter) {
        this.batchOrchestrator = batchOrchestrator;
        this.jobStatusStore = jobStatusStore;
        this.optionsResolver = optionsResolver;
        this.recordFormatter = recordFormatter;
    }

    /**
     * POST /batch-process (multipart): startet einen Job, antwortet sofort mit 202
     */
    @PostMapping(value = "/batch-process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchSubmitResponse> submit(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                      @RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                      @RequestParam(required = false) String projectName,
                                                      @RequestParam(required = false) Integer chunkSize,
                                                      @RequestParam(required = false) Integer overlap,
                                                      @RequestParam(required = false) String outputFormat,
                                                      @RequestParam(required = false) String classFilter,
                                                      @RequestParam(required = false) String chunkUnit,
                                                      @RequestParam(required = false) Boolean ocr,
                                                      @RequestParam(required = false) Integer maxRecordsPerDocument) {

        ProcessingOptions options = optionsResolver.resolve(chunkSize, overlap, outputFormat,
                classFilter, chunkUnit, ocr, maxRecordsPerDocument);

        List<InMemoryDocumentSource> sources = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                sources.add(new InMemoryDocumentSource(file.getOriginalFilename(), file.getContentType(), readBytes(file)));
            }
        }

        Job job = batchOrchestrator.submit(userId, projectName, sources, options);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchSubmitResponse.builder()
                .jobId(job.getJobId())
                .batchProjectId(job.getBatchProjectId())
                .status(job.getStatus())
                .documents(job.getDocuments().size())
                .build());
    }

    /**
     * GET /process-status?jobId=...
     */
    @GetMapping("/process-status")
    public ResponseEntity<JobStatusResponse> status(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                    @RequestParam String jobId) {
        return ResponseEntity.ok(JobStatusResponse.of(jobStatusStore.get(jobId, userId)));
    }

    /**
     * GET /batch-process?batchProjectId=...: aggregierte Records im gewählten Ausgabeformat
     */
    @GetMapping("/batch-process")
    public ResponseEntity<String> results(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                          @RequestParam String batchProjectId) {
        Job job = batchOrchestrator.getJob(batchProjectId, userId);
        List<TrainingRecord> records = batchOrchestrator.results(batchProjectId, userId);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.parseMediaType(job.getOptions().getOutputFormat().getMediaType()), StandardCharsets.UTF_8))
                .body(recordFormatter.format(records, job.getOptions().getOutputFormat()));
    }

    /**
     * POST /cancel-job
     */
    @PostMapping("/cancel-job")
    public ResponseEntity<JobStatusResponse> cancel(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                    @RequestBody CancelJobRequest req) {
        if (req == null || req.getJobId() == null || req.getJobId().isBlank()) {
            throw UploadErrorFactory.validationFailed("jobId is required");
        }
        if (req.getUserId() != null && !req.getUserId().equals(userId)) {
            throw UploadErrorFactory.forbidden(req.getUserId());
        }
        return ResponseEntity.ok(JobStatusResponse.of(batchOrchestrator.cancel(req.getJobId(), userId)));
    }

    /**
     * GET /jobs: alle Jobs des Users, neueste zuerst
     */
    @GetMapping("/jobs")
    public ResponseEntity<JobStatusListResponse> jobs(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId) {
        List<JobStatusResponse> items = jobStatusStore.findByOwner(userId).stream()
                .map(JobStatusResponse::of)
                .toList();
        return ResponseEntity.ok(JobStatusListResponse.builder()
                .total(items.size())
                .items(items)
                .build());
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InfrastructureException("unable to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
