package de.jwiegmann.trainingdata.entity;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Unveränderlicher Snapshot eines Batch-Jobs. Änderungen erzeugen eine neue Instanz,
 * damit lesende Status-Abfragen nie einen halb aktualisierten Job sehen.
 * Der Job-Status wird nicht gespeichert, sondern aus den Dokumenten abgeleitet.
 */
@Value
@With
@Builder(toBuilder = true)
public class Job {

    String jobId;
    String ownerId;
    String batchProjectId;
    String projectName;
    Instant createdAt;
    ProcessingOptions options;
    List<DocumentTask> documents;

    boolean cancelRequested;

    // Job-Level-Fehler, nur bei Infrastrukturfehlern gesetzt
    String error;

    Instant startedAt;
    Instant finishedAt;

    public JobStatus getStatus() {
        if (documents.stream().allMatch(DocumentTask::isTerminal)) {
            boolean anySucceeded = documents.stream().anyMatch(d -> d.getStatus() == DocumentStatus.SUCCEEDED);
            boolean anyFailed = documents.stream().anyMatch(d -> d.getStatus() == DocumentStatus.FAILED);
            if (anySucceeded && anyFailed) {
                return JobStatus.PARTIAL_SUCCESS;
            }
            return anyFailed ? JobStatus.FAILED : JobStatus.SUCCEEDED;
        }
        return startedAt == null ? JobStatus.CREATED : JobStatus.RUNNING;
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }

    public DocumentTask getDocument(int position) {
        return documents.get(position);
    }

    public Job withDocument(int position, UnaryOperator<DocumentTask> change) {
        List<DocumentTask> copy = new ArrayList<>(documents);
        copy.set(position, change.apply(copy.get(position)));
        return withDocuments(List.copyOf(copy));
    }

    /**
     * Markiert alle noch nicht gestarteten Dokumente als FAILED.
     */
    public Job failPending(String error) {
        List<DocumentTask> copy = documents.stream()
                .map(d -> d.getStatus() == DocumentStatus.PENDING ? d.fail(error) : d)
                .toList();
        return withDocuments(copy);
    }

    public int getCompletedCount() {
        return (int) documents.stream().filter(DocumentTask::isTerminal).count();
    }

    public int getTotalRecords() {
        return documents.stream().mapToInt(DocumentTask::getRecordCount).sum();
    }
}
