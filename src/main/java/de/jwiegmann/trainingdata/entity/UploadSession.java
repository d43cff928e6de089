package de.jwiegmann.trainingdata.entity;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Eine Chunk-Upload-Session: Metadaten der Datei plus die bisher angenommenen Chunks.
 * Mutationen laufen ausschließlich unter dem Monitor der Session (siehe ChunkStore).
 */
@Getter
@Builder
public class UploadSession {

    private final String uploadId;
    private final String ownerId;
    private final String filename;
    private final String contentType;
    private final long totalSize;
    private final int chunkSize;
    private final int totalChunks;
    private final Instant createdAt;

    // Verarbeitungsoptionen für die Übergabe an den Batch nach dem Finalize
    private final ProcessingOptions processingOptions;
    private final String projectName;

    @Setter
    private volatile UploadSessionStatus status;

    @Setter
    private volatile Instant lastActivityAt;

    @Setter
    private volatile Instant finalizedAt;

    @Setter
    private volatile String jobId;

    @Setter
    private volatile String batchProjectId;

    private long receivedBytes;

    // index -> Länge, bleibt nach dem Finalize erhalten (Idempotenz-Check)
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<Integer, Integer> chunkLengths = new TreeMap<>();

    // index -> Bytes, wird nach dem Finalize bzw. bei Ablauf geleert
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<Integer, byte[]> chunks = new TreeMap<>();

    public static int computeTotalChunks(long totalSize, int chunkSize) {
        return Math.toIntExact((totalSize + chunkSize - 1) / chunkSize);
    }

    /**
     * Erwartete Länge eines Chunks: chunkSize für alle außer dem letzten, der Rest für den letzten.
     */
    public long expectedChunkLength(int index) {
        if (index < totalChunks - 1) {
            return chunkSize;
        }
        return totalSize - (long) (totalChunks - 1) * chunkSize;
    }

    public void addChunk(int index, byte[] bytes) {
        chunks.put(index, bytes);
        chunkLengths.put(index, bytes.length);
        receivedBytes += bytes.length;
    }

    public Integer getRecordedLength(int index) {
        return chunkLengths.get(index);
    }

    /**
     * Gepufferte Bytes eines Chunks; {@code null}, wenn nie empfangen oder bereits freigegeben.
     */
    public byte[] getBufferedChunk(int index) {
        return chunks.get(index);
    }

    public int getBufferedChunkCount() {
        return chunks.size();
    }

    /**
     * Unveränderliche Kopie der gepufferten Chunks für das Zusammensetzen außerhalb des Monitors.
     */
    public Map<Integer, byte[]> copyChunks() {
        return Map.copyOf(chunks);
    }

    public int getReceivedCount() {
        return chunkLengths.size();
    }

    public boolean isFinalized() {
        return finalizedAt != null;
    }

    /**
     * Vollständig, wenn [0, totalChunks) lückenlos vorliegt und die Summe der Längen totalSize ergibt.
     */
    public boolean isAllChunksReceived() {
        return chunkLengths.size() == totalChunks && receivedBytes == totalSize;
    }

    public boolean isIdle(Instant now, Duration idleTimeout) {
        return lastActivityAt != null && now.isAfter(lastActivityAt.plus(idleTimeout));
    }

    public List<Integer> getMissingChunks() {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!chunkLengths.containsKey(i)) missing.add(i);
        }
        return missing;
    }

    public void releaseBuffers() {
        chunks.clear();
    }
}
