package de.jwiegmann.trainingdata.entity;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Ein Textfenster aus einem Dokument, wie es in die Trainingsdaten geschrieben wird.
 */
@Value
@Builder
@JsonPropertyOrder({"text", "sourceDocument", "chunkIndex", "metadata"})
public class TrainingRecord {

    public static final String CLASS_LABEL = "classLabel";

    String text;
    String sourceDocument;
    int chunkIndex;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
