package de.jwiegmann.trainingdata.boundary.dto.error;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Fehlerkörper aller synchronen API-Fehler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadError {
    private String code;
    private String message;
    private Map<String, Object> details;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
