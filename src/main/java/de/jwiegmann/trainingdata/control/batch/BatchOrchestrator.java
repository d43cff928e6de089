package de.jwiegmann.trainingdata.control.batch;

import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.control.exception.ExtractionException;
import de.jwiegmann.trainingdata.control.exception.InfrastructureException;
import de.jwiegmann.trainingdata.control.extraction.ContentTypes;
import de.jwiegmann.trainingdata.control.extraction.ExtractionResult;
import de.jwiegmann.trainingdata.control.extraction.TextExtractor;
import de.jwiegmann.trainingdata.control.processing.DocumentProcessor;
import de.jwiegmann.trainingdata.entity.DocumentStatus;
import de.jwiegmann.trainingdata.entity.DocumentTask;
import de.jwiegmann.trainingdata.entity.Job;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.TrainingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Verteilt die Dokumente eines Batches auf den begrenzten Worker-Pool und führt den Job-Status nach.
 * <p>
 * Pro Dokument: PENDING -> EXTRACTING -> PROCESSING -> SUCCEEDED, oder FAILED bei jedem Fehler.
 * Fehler eines Dokuments bleiben auf diesem Dokument; nur Infrastrukturfehler brechen den ganzen Job ab.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    static final String CANCELLED = "Cancelled";

    private final JobStatusStore jobStatusStore;
    private final BatchResultStore batchResultStore;
    private final TextExtractor textExtractor;
    private final DocumentProcessor documentProcessor;
    private final ExecutorService documentExecutor;
    private final ExecutorService extractionExecutor;
    private final Clock clock;
    private final Duration documentTimeout;
    private final Duration jobRetention;

    public BatchOrchestrator(JobStatusStore jobStatusStore,
                             BatchResultStore batchResultStore,
                             TextExtractor textExtractor,
                             DocumentProcessor documentProcessor,
                             @Qualifier(BatchConfiguration.DOCUMENT_EXECUTOR) ExecutorService documentExecutor,
                             @Qualifier(BatchConfiguration.EXTRACTION_EXECUTOR) ExecutorService extractionExecutor,
                             Clock clock,
                             @Value("${batch.document-timeout:PT2M}") Duration documentTimeout,
                             @Value("${batch.job-retention:PT24H}") Duration jobRetention) {
        this.jobStatusStore = jobStatusStore;
        this.batchResultStore = batchResultStore;
        this.textExtractor = textExtractor;
        this.documentProcessor = documentProcessor;
        this.documentExecutor = documentExecutor;
        this.extractionExecutor = extractionExecutor;
        this.clock = clock;
        this.documentTimeout = documentTimeout;
        this.jobRetention = jobRetention;
    }

    /**
     * Legt einen Job an und reicht alle Dokumente beim Worker-Pool ein. Kehrt sofort zurück.
     *
     * @return Snapshot des neuen Jobs
     */
    public Job submit(String ownerId, String projectName, List<? extends DocumentSource> sources, ProcessingOptions options) {

        if (sources == null || sources.isEmpty()) {
            throw UploadErrorFactory.validationFailed("no files provided for batch processing");
        }

        Instant now = clock.instant();
        String batchProjectId = UUID.randomUUID().toString();
        Job job = Job.builder()
                .jobId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .batchProjectId(batchProjectId)
                .projectName(projectName == null || projectName.isBlank() ? "Batch Project " + now : projectName)
                .createdAt(now)
                .options(options)
                .documents(sources.stream().map(s -> DocumentTask.pending(s.getName())).toList())
                .build();

        batchResultStore.allocate(job.getJobId(), sources.size());
        jobStatusStore.create(job);
        log.info("Batch job submitted: jobId={}, owner={}, documents={}", job.getJobId(), ownerId, sources.size());

        for (int position = 0; position < sources.size(); position++) {
            int index = position;
            DocumentSource source = sources.get(position);
            try {
                documentExecutor.execute(() -> runDocument(job.getJobId(), index, source));
            } catch (RejectedExecutionException e) {
                abort(job.getJobId(), new InfrastructureException("worker pool rejected document " + source.getName(), e));
                break;
            }
        }

        return jobStatusStore.find(job.getJobId()).orElse(job);
    }

    /**
     * Fordert den Abbruch an: noch nicht gestartete Dokumente werden nicht mehr verarbeitet,
     * laufende Dokumente laufen zu Ende, fertige Ergebnisse bleiben erhalten.
     */
    public Job cancel(String jobId, String ownerId) {
        jobStatusStore.get(jobId, ownerId);
        Job cancelled = updateJob(jobId, job -> job.isTerminal()
                ? job
                : job.withCancelRequested(true).failPending(CANCELLED));
        log.info("Cancellation requested: jobId={}, status={}", jobId, cancelled.getStatus());
        return cancelled;
    }

    /**
     * Aggregierte Records aller erfolgreichen Dokumente in Einreichungsreihenfolge.
     */
    public List<TrainingRecord> results(String batchProjectId, String ownerId) {
        Job job = jobStatusStore.findByBatchProjectId(batchProjectId, ownerId)
                .orElseThrow(() -> UploadErrorFactory.batchProjectNotFound(batchProjectId));
        if (!job.isTerminal()) {
            throw UploadErrorFactory.jobNotFinished(job.getJobId());
        }
        return batchResultStore.collect(job.getJobId());
    }

    public Job getJob(String batchProjectId, String ownerId) {
        return jobStatusStore.findByBatchProjectId(batchProjectId, ownerId)
                .orElseThrow(() -> UploadErrorFactory.batchProjectNotFound(batchProjectId));
    }

    @Scheduled(fixedDelayString = "${batch.eviction-interval:PT10M}")
    public void evictFinishedJobs() {
        List<String> evicted = jobStatusStore.evictFinishedBefore(clock.instant().minus(jobRetention));
        evicted.forEach(batchResultStore::remove);
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} finished jobs", evicted.size());
        }
    }

    void runDocument(String jobId, int position, DocumentSource source) {

        if (!claim(jobId, position)) {
            log.debug("Document not dispatched: jobId={}, position={}", jobId, position);
            return;
        }

        try {
            byte[] content = readContent(source);
            Job job = jobStatusStore.find(jobId).orElseThrow();
            ProcessingOptions options = job.getOptions();
            String contentType = ContentTypes.resolve(source.getContentType(), source.getName());

            // 1. Extraktion mit Zeitbudget
            ExtractionResult extraction = extractWithTimeout(content, contentType, options.isOcr());
            if (extraction.isEmpty()) {
                String reason = extraction.getWarnings().isEmpty()
                        ? "no text extracted"
                        : "no text extracted (" + String.join("; ", extraction.getWarnings()) + ")";
                throw new ExtractionException(reason);
            }
            updateDocument(jobId, position, d -> d.transitionTo(DocumentStatus.PROCESSING)
                    .withWarnings(extraction.getWarnings()));

            // 2. Zerlegung in TrainingRecords
            List<TrainingRecord> records = documentProcessor
                    .process(source.getName(), extraction.getText(), options)
                    .stream()
                    .toList();

            batchResultStore.put(jobId, position, records);
            updateDocument(jobId, position, d -> d.transitionTo(DocumentStatus.SUCCEEDED)
                    .withRecordCount(records.size()));
            log.debug("Document succeeded: jobId={}, document={}, records={}", jobId, source.getName(), records.size());

        } catch (ExtractionException e) {
            failDocument(jobId, position, source, "ExtractionError: " + e.getMessage());
        } catch (TimeoutException e) {
            failDocument(jobId, position, source,
                    "TimeoutError: extraction exceeded " + documentTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failDocument(jobId, position, source, "InfrastructureError: worker interrupted");
        } catch (InfrastructureException e) {
            failDocument(jobId, position, source, "InfrastructureError: " + e.getMessage());
            abort(jobId, e);
        } catch (RuntimeException e) {
            log.warn("Document processing failed: jobId={}, document={}", jobId, source.getName(), e);
            failDocument(jobId, position, source, "ProcessingError: " + e.getMessage());
        }
    }

    /**
     * Übergang PENDING -> EXTRACTING, sofern der Job nicht abgebrochen wurde.
     *
     * @return true, wenn das Dokument verarbeitet werden soll
     */
    private boolean claim(String jobId, int position) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        updateJob(jobId, job -> {
            claimed.set(false);
            DocumentTask document = job.getDocument(position);
            if (document.getStatus() != DocumentStatus.PENDING) {
                return job;
            }
            if (job.isCancelRequested() || job.getError() != null) {
                return job.withDocument(position, d -> d.fail(CANCELLED));
            }
            claimed.set(true);
            Job started = job.getStartedAt() == null ? job.withStartedAt(clock.instant()) : job;
            return started.withDocument(position, d -> d.transitionTo(DocumentStatus.EXTRACTING));
        });
        return claimed.get();
    }

    private byte[] readContent(DocumentSource source) {
        try {
            return source.read();
        } catch (IOException e) {
            throw new InfrastructureException("unable to read input " + source.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Das Zeitbudget läuft ab dem Start der Extraktion, nicht ab dem Einreichen. Wartezeit auf einen freien
     * Extraktions-Thread zählt also nicht gegen das Dokument.
     */
    private ExtractionResult extractWithTimeout(byte[] content, String contentType, boolean useOcr)
            throws ExtractionException, TimeoutException, InterruptedException {

        CountDownLatch started = new CountDownLatch(1);
        Future<ExtractionResult> future;
        try {
            future = extractionExecutor.submit(() -> {
                started.countDown();
                return textExtractor.extract(content, contentType, useOcr);
            });
        } catch (RejectedExecutionException e) {
            throw new InfrastructureException("extraction pool rejected work", e);
        }

        try {
            started.await();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }

        try {
            return future.get(documentTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Extraktionen, die Interrupts ignorieren, laufen weiter; der Pool wächst dafür nach
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException) {
                throw (ExtractionException) cause;
            }
            throw new ExtractionException(String.valueOf(cause), cause);
        }
    }

    private void failDocument(String jobId, int position, DocumentSource source, String error) {
        log.warn("Document failed: jobId={}, document={}, error={}", jobId, source.getName(), error);
        updateDocument(jobId, position, d -> d.isTerminal() ? d : d.fail(error));
    }

    /**
     * Bricht den Job ab: alle noch nicht gestarteten Dokumente werden mit der Ursache als FAILED markiert.
     */
    private void abort(String jobId, InfrastructureException cause) {
        log.error("Batch job aborted: jobId={}", jobId, cause);
        updateJob(jobId, job -> job.withError(cause.getMessage())
                .failPending("InfrastructureError: " + cause.getMessage()));
    }

    private Job updateDocument(String jobId, int position, UnaryOperator<DocumentTask> change) {
        return updateJob(jobId, job -> job.withDocument(position, change));
    }

    /**
     * Serialisiertes Update; setzt finishedAt genau einmal, sobald alle Dokumente terminal sind.
     */
    private Job updateJob(String jobId, UnaryOperator<Job> mutator) {
        AtomicBoolean finishedNow = new AtomicBoolean(false);
        Job updated = jobStatusStore.update(jobId, current -> {
            finishedNow.set(false);
            Job next = mutator.apply(current);
            if (next.isTerminal() && next.getFinishedAt() == null) {
                finishedNow.set(true);
                return next.withFinishedAt(clock.instant());
            }
            return next;
        });
        if (finishedNow.get()) {
            log.info("Batch job finished: jobId={}, status={}, documents={}, records={}",
                    jobId, updated.getStatus(), updated.getDocuments().size(), updated.getTotalRecords());
        }
        return updated;
    }
}
