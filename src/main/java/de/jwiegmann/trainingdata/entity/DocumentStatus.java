package de.jwiegmann.trainingdata.entity;

/**
 * Status eines einzelnen Dokuments innerhalb eines Jobs. Die Reihenfolge der Konstanten ist die Fortschrittsreihenfolge.
 */
public enum DocumentStatus {
    PENDING,
    EXTRACTING,
    PROCESSING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Nur vorwärts; FAILED ist aus jedem nicht-terminalen Zustand erreichbar.
     */
    public boolean canTransitionTo(DocumentStatus next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() > ordinal();
    }
}
