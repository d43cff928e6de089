package de.jwiegmann.trainingdata.control.upload;

import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Ergebnis eines PutChunk-Aufrufs.
 */
@Value
@Builder
public class ChunkReceipt {
    String uploadId;
    int index;
    int received;
    int totalChunks;
    UploadSessionStatus status;

    // false bei idempotenter Wiederholung
    boolean accepted;

    // true nur für genau den Chunk, der die Session auf COMPLETE gebracht hat
    boolean completedSession;
}
