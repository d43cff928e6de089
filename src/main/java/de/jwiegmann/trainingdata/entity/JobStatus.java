package de.jwiegmann.trainingdata.entity;

public enum JobStatus {
    CREATED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    PARTIAL_SUCCESS;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == PARTIAL_SUCCESS;
    }
}
