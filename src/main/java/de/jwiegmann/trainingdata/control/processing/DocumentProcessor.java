package de.jwiegmann.trainingdata.control.processing;

import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import org.springframework.stereotype.Component;

/**
 * Zerlegt extrahierten Text in überlappende Fenster und erzeugt daraus TrainingRecords.
 * Die Zerlegung ist rein positionsbasiert und damit für gleiche Eingaben deterministisch.
 */
@Component
public class DocumentProcessor {

    private final Classifier classifier;

    public DocumentProcessor(Classifier classifier) {
        this.classifier = classifier;
    }

    public TrainingRecordSequence process(String sourceDocument, String text, ProcessingOptions options) {
        validate(options);
        return new TrainingRecordSequence(sourceDocument, text == null ? "" : text, options, classifier);
    }

    static void validate(ProcessingOptions options) {
        if (options.getChunkSize() <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (options.getOverlap() < 0 || options.getOverlap() >= options.getChunkSize()) {
            throw new IllegalArgumentException("overlap must be >= 0 and < chunkSize");
        }
    }
}
