package de.jwiegmann.trainingdata.control.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback, solange keine OCR-Engine als Bean registriert ist.
 */
@Slf4j
public class NoOpOcrEngine implements OcrEngine {

    @Override
    public String recognize(byte[] content, String contentType) {
        log.warn("OCR requested for {} ({} bytes) but no OCR engine is configured", contentType, content.length);
        return "";
    }

    @Configuration
    static class OcrEngineConfiguration {

        @Bean
        @ConditionalOnMissingBean(OcrEngine.class)
        OcrEngine noOpOcrEngine() {
            return new NoOpOcrEngine();
        }
    }
}
