package de.jwiegmann.trainingdata.control.extraction;

import de.jwiegmann.trainingdata.control.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Textextraktion für PDF (seitenweise über PDFBox) und Plain Text (striktes UTF-8).
 */
@Slf4j
@Component
public class PdfBoxTextExtractor implements TextExtractor {

    static final String PAGE_SEPARATOR = "\n\n";

    private final OcrEngine ocrEngine;
    private final int maxPages;

    public PdfBoxTextExtractor(OcrEngine ocrEngine, @Value("${extraction.max-pages:100}") int maxPages) {
        this.ocrEngine = ocrEngine;
        this.maxPages = maxPages;
    }

    @Override
    public ExtractionResult extract(byte[] content, String contentType, boolean useOcr) throws ExtractionException {
        String type = ContentTypes.resolve(contentType, null);

        return switch (type) {
            case ContentTypes.PDF -> extractPdf(content, useOcr);
            case ContentTypes.PLAIN_TEXT -> ExtractionResult.of(decodeUtf8(content), List.of());
            default -> {
                log.warn("Unsupported content type for extraction: {}", contentType);
                yield ExtractionResult.of("", List.of("unsupported content type: " + contentType));
            }
        };
    }

    private ExtractionResult extractPdf(byte[] content, boolean useOcr) {
        List<String> warnings = new ArrayList<>();
        String text;

        try (PDDocument document = Loader.loadPDF(content)) {
            text = extractPages(document, warnings);
        } catch (InvalidPasswordException e) {
            log.warn("PDF is password protected: {}", e.getMessage());
            warnings.add("document is password protected");
            text = "";
        } catch (IOException e) {
            log.warn("PDF could not be parsed: {}", e.getMessage());
            warnings.add("unreadable PDF: " + e.getMessage());
            text = "";
        }

        if (text.isBlank() && useOcr) {
            warnings.add("no text layer found, falling back to OCR");
            try {
                text = ocrEngine.recognize(content, ContentTypes.PDF);
            } catch (IOException e) {
                log.warn("OCR failed: {}", e.getMessage());
                warnings.add("OCR failed: " + e.getMessage());
                text = "";
            }
        }

        return ExtractionResult.of(text, warnings);
    }

    /**
     * Extrahiert Seite für Seite. Fehler auf einer Seite werden als Warnung vermerkt, die übrigen Seiten laufen weiter.
     */
    private String extractPages(PDDocument document, List<String> warnings) throws IOException {
        int pageCount = document.getNumberOfPages();
        int limit = Math.min(pageCount, maxPages);
        if (pageCount > maxPages) {
            warnings.add("document has " + pageCount + " pages, only the first " + maxPages + " were extracted");
        }

        PDFTextStripper stripper = new PDFTextStripper();
        List<String> pages = new ArrayList<>();

        for (int page = 1; page <= limit; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            try {
                String pageText = stripper.getText(document).strip();
                if (!pageText.isEmpty()) {
                    pages.add(pageText);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Text extraction failed on page {}: {}", page, e.toString());
                warnings.add("page " + page + ": " + e.getMessage());
            }
        }

        return String.join(PAGE_SEPARATOR, pages);
    }

    private static String decodeUtf8(byte[] content) throws ExtractionException {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            // BOM entfernen
            return text.startsWith("\uFEFF") ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new ExtractionException("text is not valid UTF-8", e);
        }
    }
}
