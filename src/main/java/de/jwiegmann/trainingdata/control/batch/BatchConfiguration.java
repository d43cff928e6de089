package de.jwiegmann.trainingdata.control.batch;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker-Pools der Batch-Verarbeitung. Die Parallelität begrenzt der Dokument-Pool; beide Pools werden mit dem Context heruntergefahren.
 */
@Configuration
public class BatchConfiguration {

    public static final String DOCUMENT_EXECUTOR = "documentExecutor";
    public static final String EXTRACTION_EXECUTOR = "extractionExecutor";

    @Bean(name = DOCUMENT_EXECUTOR, destroyMethod = "shutdownNow")
    ExecutorService documentExecutor(@Value("${batch.worker-pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("batch-document-"));
    }

    /**
     * Extraktion läuft getrennt, damit der Dokument-Worker das Zeitbudget durchsetzen kann.
     * Laufende Extraktionen sind durch die Dokument-Worker begrenzt; nach einem Timeout verworfene,
     * aber weiterlaufende Extraktionen belegen eigene Threads und blockieren keine nachfolgenden Dokumente.
     */
    @Bean(name = EXTRACTION_EXECUTOR, destroyMethod = "shutdownNow")
    ExecutorService extractionExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("batch-extraction-"));
    }
}
