package de.jwiegmann.trainingdata.control.upload;

import de.jwiegmann.trainingdata.control.batch.BatchOrchestrator;
import de.jwiegmann.trainingdata.control.batch.InMemoryDocumentSource;
import de.jwiegmann.trainingdata.entity.Job;
import de.jwiegmann.trainingdata.entity.UploadSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Verbindet Chunk-Upload und Batch-Verarbeitung: der Chunk, der eine Session vervollständigt,
 * löst das Finalize aus und übergibt die Datei als Ein-Dokument-Job an den Orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadService {

    private final ChunkStore chunkStore;
    private final BatchOrchestrator batchOrchestrator;

    public ChunkReceipt putChunk(String ownerId, String uploadId, int index, byte[] bytes) {

        ChunkReceipt receipt = chunkStore.putChunk(ownerId, uploadId, index, bytes);

        if (receipt.isCompletedSession()) {
            UploadSession session = chunkStore.get(ownerId, uploadId);
            byte[] assembled = chunkStore.finalizeUpload(ownerId, uploadId);

            // Puffer sind nach dem Finalize freigegeben: ohne Job ist die Session verloren
            Job job;
            try {
                job = batchOrchestrator.submit(ownerId,
                        session.getProjectName(),
                        List.of(new InMemoryDocumentSource(session.getFilename(), session.getContentType(), assembled)),
                        session.getProcessingOptions());
            } catch (RuntimeException e) {
                log.error("Batch submission failed, upload discarded: uploadId={}, file={}", uploadId, session.getFilename(), e);
                chunkStore.markFailed(ownerId, uploadId);
                throw e;
            }

            session.setJobId(job.getJobId());
            session.setBatchProjectId(job.getBatchProjectId());
            log.info("Upload handed to batch processing: uploadId={}, jobId={}", uploadId, job.getJobId());
        }

        return receipt;
    }
}
