package de.jwiegmann.trainingdata.control.extraction;

import de.jwiegmann.trainingdata.control.exception.ExtractionException;

/**
 * Gewinnt Text aus einem Dokumentpuffer.
 */
public interface TextExtractor {

    /**
     * Unbekannte oder beschädigte Eingaben liefern leeren Text plus Warnung statt einer Exception;
     * ob leerer Text ein Fehler ist, entscheidet der Aufrufer.
     *
     * @param content     Dokumentinhalt
     * @param contentType normalisierter Content-Type
     * @param useOcr      OCR versuchen, falls die normale Extraktion keinen Text liefert
     * @throws ExtractionException wenn der Inhalt nicht dekodiert werden kann
     */
    ExtractionResult extract(byte[] content, String contentType, boolean useOcr) throws ExtractionException;
}
