package de.jwiegmann.trainingdata.control.exception;

/**
 * Text konnte aus einem einzelnen Dokument nicht gewonnen werden. Betrifft nur dieses Dokument, nie den ganzen Batch.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
