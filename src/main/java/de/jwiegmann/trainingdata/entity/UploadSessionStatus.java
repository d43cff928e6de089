package de.jwiegmann.trainingdata.entity;

/**
 * Lebenszyklus einer Chunk-Upload-Session.
 */
public enum UploadSessionStatus {
    INITIALIZED,   // angelegt, noch kein Chunk
    IN_PROGRESS,   // mindestens ein Chunk angenommen
    COMPLETE,      // alle Chunks vollständig, bereit zum Zusammensetzen
    FAILED,        // Zusammensetzen oder Übergabe an den Batch fehlgeschlagen
    EXPIRED        // zu lange inaktiv
}
