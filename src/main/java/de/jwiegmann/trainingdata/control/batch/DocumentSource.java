package de.jwiegmann.trainingdata.control.batch;

import java.io.IOException;

/**
 * Eingabe eines Batch-Dokuments. Der Inhalt wird erst vom Worker gelesen.
 */
public interface DocumentSource {

    String getName();

    String getContentType();

    byte[] read() throws IOException;
}
