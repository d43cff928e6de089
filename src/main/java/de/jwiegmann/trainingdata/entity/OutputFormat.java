package de.jwiegmann.trainingdata.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {

    JSONL("jsonl", "application/x-ndjson"),
    CSV("csv", "text/csv");

    private final String value;
    private final String mediaType;

    OutputFormat(String value, String mediaType) {
        this.value = value;
        this.mediaType = mediaType;
    }

    public String getValue() {
        return value;
    }

    public String getMediaType() {
        return mediaType;
    }

    public static Optional<OutputFormat> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.value.equals(normalized))
                .findFirst();
    }
}
