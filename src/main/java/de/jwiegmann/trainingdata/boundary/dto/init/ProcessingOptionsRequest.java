package de.jwiegmann.trainingdata.boundary.dto.init;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optionale Verarbeitungsoptionen; fehlende Werte werden aus der Konfiguration ergänzt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingOptionsRequest {
    private Integer chunkSize;
    private Integer overlap;
    private String outputFormat;   // jsonl | csv
    private String classFilter;    // all | Critical | Important | Standard
    private String chunkUnit;      // character | token
    private Boolean ocr;
    private Integer maxRecordsPerDocument;
}
