package de.jwiegmann.trainingdata.control.extraction;

import java.io.IOException;

/**
 * Anbindung einer externen OCR-Engine für Dokumente ohne Textebene (z.B. gescannte PDFs).
 */
public interface OcrEngine {

    String recognize(byte[] content, String contentType) throws IOException;
}
