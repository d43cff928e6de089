package de.jwiegmann.trainingdata.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Optionen, mit denen extrahierter Text in TrainingRecords zerlegt wird.
 */
@Value
@Builder(toBuilder = true)
public class ProcessingOptions {

    public static final String ALL_CLASSES = "all";

    int chunkSize;
    int overlap;

    @Builder.Default
    ChunkUnit chunkUnit = ChunkUnit.CHARACTER;

    @Builder.Default
    OutputFormat outputFormat = OutputFormat.JSONL;

    @Builder.Default
    String classFilter = ALL_CLASSES;

    boolean ocr;

    // 0 = unbegrenzt
    int maxRecordsPerDocument;

    public boolean isClassFilterActive() {
        return classFilter != null && !classFilter.isBlank() && !ALL_CLASSES.equalsIgnoreCase(classFilter);
    }
}
