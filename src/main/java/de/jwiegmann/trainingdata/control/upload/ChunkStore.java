package de.jwiegmann.trainingdata.control.upload;

import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.control.extraction.ContentTypes;
import de.jwiegmann.trainingdata.control.repository.UploadSessionRepository;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.UploadSession;
import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hält laufende Chunk-Uploads und setzt sie nach vollständigem Empfang zu einer Datei zusammen.
 * Alle Zustandsübergänge einer Session laufen unter deren Monitor; verschiedene Sessions blockieren sich nicht.
 */
@Slf4j
@Component
public class ChunkStore {

    private final UploadSessionRepository uploadSessionRepository;
    private final Clock clock;
    private final int defaultChunkSize;
    private final long maxFileSize;
    private final Set<String> allowedContentTypes;
    private final Duration sessionIdleTimeout;
    private final Duration sessionRetention;

    public ChunkStore(UploadSessionRepository uploadSessionRepository,
                      Clock clock,
                      @Value("${upload.default-chunk-size:5242880}") int defaultChunkSize,
                      @Value("${upload.max-file-size:524288000}") long maxFileSize,
                      @Value("${upload.allowed-content-types:application/pdf,text/plain}") List<String> allowedContentTypes,
                      @Value("${upload.session.idle-timeout:PT2H}") Duration sessionIdleTimeout,
                      @Value("${upload.session.retention:PT10M}") Duration sessionRetention) {
        this.uploadSessionRepository = uploadSessionRepository;
        this.clock = clock;
        this.defaultChunkSize = defaultChunkSize;
        this.maxFileSize = Math.min(maxFileSize, Integer.MAX_VALUE - 8);
        this.allowedContentTypes = allowedContentTypes.stream()
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
        this.sessionIdleTimeout = sessionIdleTimeout;
        this.sessionRetention = sessionRetention;
    }

    /**
     * Legt eine neue Upload-Session an.
     *
     * @param chunkSize  gewünschte Chunk-Größe, {@code null} für den konfigurierten Default
     * @param options    Verarbeitungsoptionen für den Batch nach dem Finalize
     * @return Session im Status INITIALIZED
     */
    public UploadSession initUpload(String ownerId,
                                    String filename,
                                    String contentType,
                                    long totalSize,
                                    Integer chunkSize,
                                    ProcessingOptions options,
                                    String projectName) {

        // 1. Metadaten prüfen
        if (filename == null || filename.isBlank()) {
            throw UploadErrorFactory.validationFailed("filename is required");
        }
        String resolvedType = ContentTypes.resolve(contentType, filename);
        if (!allowedContentTypes.contains(resolvedType)) {
            throw UploadErrorFactory.unsupportedContentType(contentType);
        }
        if (totalSize <= 0) {
            throw UploadErrorFactory.validationFailed("fileSize must be > 0");
        }
        if (totalSize > maxFileSize) {
            throw UploadErrorFactory.validationFailed("fileSize exceeds maximum of " + maxFileSize + " bytes");
        }
        int effectiveChunkSize = chunkSize == null ? defaultChunkSize : chunkSize;
        if (effectiveChunkSize <= 0) {
            throw UploadErrorFactory.validationFailed("chunkSize must be > 0");
        }

        // 2. Session erzeugen und speichern
        Instant now = clock.instant();
        UploadSession session = UploadSession.builder()
                .uploadId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .filename(filename)
                .contentType(resolvedType)
                .totalSize(totalSize)
                .chunkSize(effectiveChunkSize)
                .totalChunks(UploadSession.computeTotalChunks(totalSize, effectiveChunkSize))
                .createdAt(now)
                .processingOptions(options)
                .projectName(projectName)
                .status(UploadSessionStatus.INITIALIZED)
                .lastActivityAt(now)
                .build();

        uploadSessionRepository.save(session);
        log.info("Upload initialized: uploadId={}, owner={}, file={}, size={}, totalChunks={}",
                session.getUploadId(), ownerId, filename, totalSize, session.getTotalChunks());
        return session;
    }

    /**
     * Nimmt einen Chunk an. Wiederholungen mit identischem Inhalt sind ein No-Op,
     * abweichender Inhalt unter demselben Index wird abgelehnt.
     */
    public ChunkReceipt putChunk(String ownerId, String uploadId, int index, byte[] bytes) {

        UploadSession session = get(ownerId, uploadId);
        byte[] content = bytes == null ? new byte[0] : bytes;

        synchronized (session) {
            Instant now = clock.instant();
            ensureNotExpired(session, now);

            if (index < 0 || index >= session.getTotalChunks()) {
                throw UploadErrorFactory.chunkOutOfRange(index, session.getTotalChunks());
            }

            // Idempotenz: bereits empfangener Index
            Integer recordedLength = session.getRecordedLength(index);
            if (recordedLength != null) {
                byte[] recorded = session.getBufferedChunk(index);
                boolean identical = recordedLength == content.length
                        && (recorded == null || Arrays.equals(recorded, content));
                if (!identical) {
                    throw UploadErrorFactory.chunkConflict(index, recordedLength, content.length);
                }
                session.setLastActivityAt(now);
                log.debug("Chunk re-submitted: uploadId={}, index={}", uploadId, index);
                return receipt(session, index, false, false);
            }

            if (session.isFinalized()) {
                throw UploadErrorFactory.uploadAlreadyFinalized(uploadId);
            }

            long expected = session.expectedChunkLength(index);
            if (content.length != expected) {
                throw UploadErrorFactory.chunkSizeMismatch(index, expected, content.length);
            }

            session.addChunk(index, content);
            session.setLastActivityAt(now);

            if (session.getStatus() == UploadSessionStatus.INITIALIZED) {
                session.setStatus(UploadSessionStatus.IN_PROGRESS);
            }

            boolean completedNow = false;
            if (session.getStatus() == UploadSessionStatus.IN_PROGRESS && session.isAllChunksReceived()) {
                session.setStatus(UploadSessionStatus.COMPLETE);
                completedNow = true;
                log.info("Upload complete: uploadId={}, chunks={}", uploadId, session.getTotalChunks());
            }

            log.debug("Chunk received: uploadId={}, index={}, length={}, received={}/{}",
                    uploadId, index, content.length, session.getReceivedCount(), session.getTotalChunks());
            return receipt(session, index, true, completedNow);
        }
    }

    /**
     * Setzt die Chunks in Index-Reihenfolge zu einem Puffer zusammen. Pro Session genau einmal möglich.
     */
    public byte[] finalizeUpload(String ownerId, String uploadId) {

        UploadSession session = get(ownerId, uploadId);
        Map<Integer, byte[]> parts;

        synchronized (session) {
            ensureNotExpired(session, clock.instant());
            if (session.isFinalized()) {
                throw UploadErrorFactory.uploadAlreadyFinalized(uploadId);
            }
            if (session.getStatus() != UploadSessionStatus.COMPLETE) {
                throw UploadErrorFactory.uploadIncomplete(uploadId, session.getReceivedCount(), session.getTotalChunks());
            }
            session.setFinalizedAt(clock.instant());
            parts = session.copyChunks();
            session.releaseBuffers();
        }

        // Zusammensetzen außerhalb des Monitors, Status-Abfragen blockieren nicht
        byte[] assembled = new byte[Math.toIntExact(session.getTotalSize())];
        int offset = 0;
        for (int i = 0; i < session.getTotalChunks(); i++) {
            byte[] part = parts.get(i);
            System.arraycopy(part, 0, assembled, offset, part.length);
            offset += part.length;
        }

        if (offset != assembled.length) {
            session.setStatus(UploadSessionStatus.FAILED);
            throw new IllegalStateException("assembled " + offset + " of " + assembled.length + " bytes for upload " + uploadId);
        }

        log.info("Upload finalized: uploadId={}, bytes={}", uploadId, assembled.length);
        return assembled;
    }

    /**
     * Markiert eine finalisierte Session als FAILED, wenn die zusammengesetzte Datei nicht weiterverarbeitet werden konnte.
     */
    public void markFailed(String ownerId, String uploadId) {
        UploadSession session = get(ownerId, uploadId);
        synchronized (session) {
            session.setStatus(UploadSessionStatus.FAILED);
        }
        log.warn("Upload session failed: uploadId={}", uploadId);
    }

    /**
     * Liefert die Session des Owners. Fremde Sessions sind nicht sichtbar.
     */
    public UploadSession get(String ownerId, String uploadId) {
        return uploadSessionRepository.find(uploadId)
                .filter(s -> s.getOwnerId().equals(ownerId))
                .orElseThrow(() -> UploadErrorFactory.uploadNotFound(uploadId));
    }

    public Instant expiresAt(UploadSession session) {
        return session.getLastActivityAt().plus(sessionIdleTimeout);
    }

    /**
     * Markiert inaktive Sessions als EXPIRED und entfernt abgeschlossene Sessions nach Ablauf der Aufbewahrungszeit.
     *
     * @return Anzahl entfernter Sessions
     */
    @Scheduled(fixedDelayString = "${upload.session.sweep-interval:PT1M}")
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;

        for (UploadSession session : uploadSessionRepository.findAll()) {
            synchronized (session) {
                if (session.isFinalized()) {
                    if (now.isAfter(session.getFinalizedAt().plus(sessionRetention))) {
                        uploadSessionRepository.delete(session.getUploadId());
                        removed++;
                    }
                } else if (session.getStatus() == UploadSessionStatus.EXPIRED) {
                    if (now.isAfter(session.getLastActivityAt().plus(sessionIdleTimeout).plus(sessionRetention))) {
                        uploadSessionRepository.delete(session.getUploadId());
                        removed++;
                    }
                } else if (session.isIdle(now, sessionIdleTimeout)) {
                    expire(session);
                }
            }
        }

        if (removed > 0) {
            log.debug("Upload sweep removed {} sessions", removed);
        }
        return removed;
    }

    private void ensureNotExpired(UploadSession session, Instant now) {
        if (session.getStatus() == UploadSessionStatus.EXPIRED) {
            throw UploadErrorFactory.uploadExpired(session.getUploadId());
        }
        if (!session.isFinalized() && session.isIdle(now, sessionIdleTimeout)) {
            expire(session);
            throw UploadErrorFactory.uploadExpired(session.getUploadId());
        }
    }

    private void expire(UploadSession session) {
        session.setStatus(UploadSessionStatus.EXPIRED);
        session.releaseBuffers();
        log.warn("Upload session expired: uploadId={}, received={}/{}",
                session.getUploadId(), session.getReceivedCount(), session.getTotalChunks());
    }

    private static ChunkReceipt receipt(UploadSession session, int index, boolean accepted, boolean completedNow) {
        return ChunkReceipt.builder()
                .uploadId(session.getUploadId())
                .index(index)
                .received(session.getReceivedCount())
                .totalChunks(session.getTotalChunks())
                .status(session.getStatus())
                .accepted(accepted)
                .completedSession(completedNow)
                .build();
    }
}
