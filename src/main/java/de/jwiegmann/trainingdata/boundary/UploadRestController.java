package de.jwiegmann.trainingdata.boundary;

import de.jwiegmann.trainingdata.boundary.auth.BearerAuthInterceptor;
import de.jwiegmann.trainingdata.boundary.dto.chunk.ChunkUploadResponse;
import de.jwiegmann.trainingdata.boundary.dto.init.ProcessingOptionsRequest;
import de.jwiegmann.trainingdata.boundary.dto.init.UploadInitRequest;
import de.jwiegmann.trainingdata.boundary.dto.init.UploadInitResponse;
import de.jwiegmann.trainingdata.boundary.dto.status.UploadStatusResponse;
import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.control.processing.ProcessingOptionsResolver;
import de.jwiegmann.trainingdata.control.upload.ChunkReceipt;
import de.jwiegmann.trainingdata.control.upload.ChunkStore;
import de.jwiegmann.trainingdata.control.upload.UploadService;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.UploadSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/upload")
public class UploadRestController {

    private final ChunkStore chunkStore;
    private final UploadService uploadService;
    private final ProcessingOptionsResolver optionsResolver;

    public UploadRestController(ChunkStore chunkStore,
                                UploadService uploadService,
                                ProcessingOptionsResolver optionsResolver) {
        this.chunkStore = chunkStore;
        this.uploadService = uploadService;
        this.optionsResolver = optionsResolver;
    }

    /**
     * POST /upload/init
     */
    @PostMapping("/init")
    public ResponseEntity<UploadInitResponse> init(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                   @RequestBody UploadInitRequest req) {

        if (req == null) {
            throw UploadErrorFactory.validationFailed("invalid init payload");
        }

        ProcessingOptionsRequest p = req.getProcessing() == null ? new ProcessingOptionsRequest() : req.getProcessing();
        ProcessingOptions options = optionsResolver.resolve(p.getChunkSize(), p.getOverlap(), p.getOutputFormat(),
                p.getClassFilter(), p.getChunkUnit(), p.getOcr(), p.getMaxRecordsPerDocument());

        UploadSession s = chunkStore.initUpload(userId, req.getFilename(), req.getContentType(),
                req.getFileSize(), req.getChunkSize(), options, req.getProjectName());

        return ResponseEntity
                .created(URI.create("/upload/" + s.getUploadId()))
                .body(UploadInitResponse.builder()
                        .uploadId(s.getUploadId())
                        .status(s.getStatus())
                        .chunkSize(s.getChunkSize())
                        .totalChunks(s.getTotalChunks())
                        .createdAt(s.getCreatedAt())
                        .expiresAt(chunkStore.expiresAt(s))
                        .build());
    }

    /**
     * PUT|POST /upload/{uploadId}/chunk/{index}: Binärinhalt eines Chunks
     */
    @RequestMapping(value = "/{uploadId}/chunk/{index}", method = {RequestMethod.PUT, RequestMethod.POST})
    public ResponseEntity<ChunkUploadResponse> putChunk(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                        @PathVariable String uploadId,
                                                        @PathVariable int index,
                                                        @RequestBody(required = false) byte[] body) {

        ChunkReceipt receipt = uploadService.putChunk(userId, uploadId, index, body);
        UploadSession s = chunkStore.get(userId, uploadId);

        return ResponseEntity.ok(ChunkUploadResponse.builder()
                .uploadId(uploadId)
                .index(index)
                .received(receipt.getReceived())
                .totalChunks(receipt.getTotalChunks())
                .status(receipt.getStatus())
                .jobId(s.getJobId())
                .batchProjectId(s.getBatchProjectId())
                .build());
    }

    /**
     * GET /upload/{uploadId}: Status eines Uploads
     */
    @GetMapping("/{uploadId}")
    public ResponseEntity<UploadStatusResponse> getStatus(@RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) String userId,
                                                          @PathVariable String uploadId) {

        UploadSession s = chunkStore.get(userId, uploadId);
        UploadStatusResponse response;
        synchronized (s) {
            response = UploadStatusResponse.builder()
                    .uploadId(s.getUploadId())
                    .filename(s.getFilename())
                    .status(s.getStatus())
                    .finalized(s.isFinalized())
                    .received(s.getReceivedCount())
                    .totalChunks(s.getTotalChunks())
                    .missingChunks(s.getMissingChunks())
                    .jobId(s.getJobId())
                    .batchProjectId(s.getBatchProjectId())
                    .build();
        }
        return ResponseEntity.ok(response);
    }
}
