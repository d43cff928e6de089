package de.jwiegmann.trainingdata.control.exception;

/**
 * Fehler der Laufzeitumgebung (Eingabe nicht lesbar, Worker-Pool nicht verfügbar). Bricht den ganzen Job ab.
 */
public class InfrastructureException extends RuntimeException {

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
