package de.jwiegmann.trainingdata.control.processing;

import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.entity.ChunkUnit;
import de.jwiegmann.trainingdata.entity.OutputFormat;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Baut aus optionalen Request-Werten validierte ProcessingOptions; fehlende Werte kommen aus der Konfiguration.
 */
@Component
public class ProcessingOptionsResolver {

    private final int defaultChunkSize;
    private final int defaultOverlap;

    public ProcessingOptionsResolver(@Value("${processing.default-chunk-size:1000}") int defaultChunkSize,
                                     @Value("${processing.default-overlap:100}") int defaultOverlap) {
        this.defaultChunkSize = defaultChunkSize;
        this.defaultOverlap = defaultOverlap;
    }

    public ProcessingOptions resolve(Integer chunkSize,
                                     Integer overlap,
                                     String outputFormat,
                                     String classFilter,
                                     String chunkUnit,
                                     Boolean ocr,
                                     Integer maxRecordsPerDocument) {

        int size = chunkSize == null ? defaultChunkSize : chunkSize;
        int over = overlap == null ? Math.min(defaultOverlap, Math.max(size - 1, 0)) : overlap;

        if (size <= 0) {
            throw UploadErrorFactory.validationFailed("chunkSize must be > 0");
        }
        if (over < 0 || over >= size) {
            throw UploadErrorFactory.validationFailed("overlap must be >= 0 and < chunkSize");
        }
        if (maxRecordsPerDocument != null && maxRecordsPerDocument < 0) {
            throw UploadErrorFactory.validationFailed("maxRecordsPerDocument must be >= 0");
        }

        OutputFormat format = outputFormat == null || outputFormat.isBlank()
                ? OutputFormat.JSONL
                : OutputFormat.fromValue(outputFormat)
                        .orElseThrow(() -> UploadErrorFactory.validationFailed("unsupported outputFormat: " + outputFormat));

        return ProcessingOptions.builder()
                .chunkSize(size)
                .overlap(over)
                .chunkUnit(parseChunkUnit(chunkUnit))
                .outputFormat(format)
                .classFilter(classFilter == null || classFilter.isBlank() ? ProcessingOptions.ALL_CLASSES : classFilter.trim())
                .ocr(Boolean.TRUE.equals(ocr))
                .maxRecordsPerDocument(maxRecordsPerDocument == null ? 0 : maxRecordsPerDocument)
                .build();
    }

    private static ChunkUnit parseChunkUnit(String chunkUnit) {
        if (chunkUnit == null || chunkUnit.isBlank()) {
            return ChunkUnit.CHARACTER;
        }
        return switch (chunkUnit.trim().toLowerCase(Locale.ROOT)) {
            case "character", "characters", "char" -> ChunkUnit.CHARACTER;
            case "token", "tokens" -> ChunkUnit.TOKEN;
            default -> throw UploadErrorFactory.validationFailed("unsupported chunkUnit: " + chunkUnit);
        };
    }
}
