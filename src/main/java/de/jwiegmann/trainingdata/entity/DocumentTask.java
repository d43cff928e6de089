package de.jwiegmann.trainingdata.entity;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Unveränderlicher Snapshot eines Dokuments innerhalb eines Jobs.
 */
@Value
@With
@Builder(toBuilder = true)
public class DocumentTask {

    String name;

    @Builder.Default
    DocumentStatus status = DocumentStatus.PENDING;

    String error;
    int recordCount;

    @Builder.Default
    List<String> warnings = List.of();

    public static DocumentTask pending(String name) {
        return DocumentTask.builder().name(name).build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public DocumentTask transitionTo(DocumentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("document '" + name + "' cannot move from " + status + " to " + next);
        }
        return withStatus(next);
    }

    public DocumentTask fail(String error) {
        return transitionTo(DocumentStatus.FAILED).withError(error);
    }
}
