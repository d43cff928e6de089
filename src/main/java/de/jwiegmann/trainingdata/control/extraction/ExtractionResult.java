package de.jwiegmann.trainingdata.control.extraction;

import lombok.Value;

import java.util.List;

@Value
public class ExtractionResult {

    String text;
    List<String> warnings;

    public static ExtractionResult of(String text, List<String> warnings) {
        return new ExtractionResult(text == null ? "" : text, List.copyOf(warnings));
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
