package de.jwiegmann.trainingdata.control.upload;

import de.jwiegmann.trainingdata.MutableClock;
import de.jwiegmann.trainingdata.control.exception.ApiException;
import de.jwiegmann.trainingdata.control.exception.ErrorCode;
import de.jwiegmann.trainingdata.control.repository.InMemoryUploadSessionRepository;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.UploadSession;
import de.jwiegmann.trainingdata.entity.UploadSessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStoreTest {

    private static final int MB = 1024 * 1024;
    private static final String OWNER = "user-1";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private InMemoryUploadSessionRepository repository;
    private ChunkStore chunkStore;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUploadSessionRepository();
        chunkStore = new ChunkStore(repository, clock, 5 * MB, 500L * MB,
                List.of("application/pdf", "text/plain"), Duration.ofHours(2), Duration.ofMinutes(10));
    }

    @Test
    void chunks_in_reverse_order_assemble_to_original_file() {

        // 1) Init: 12 MB bei 5 MB Chunks -> 3 Chunks
        byte[] file = pattern(12 * MB);
        UploadSession s = chunkStore.initUpload(OWNER, "a.pdf", "application/pdf", file.length, null, options(), null);
        assertThat(s.getTotalChunks()).isEqualTo(3);
        assertThat(s.getStatus()).isEqualTo(UploadSessionStatus.INITIALIZED);

        // 2) Chunks rückwärts senden
        ChunkReceipt r2 = chunkStore.putChunk(OWNER, s.getUploadId(), 2, slice(file, 2, 5 * MB));
        assertThat(r2.getStatus()).isEqualTo(UploadSessionStatus.IN_PROGRESS);
        assertThat(r2.isCompletedSession()).isFalse();
        chunkStore.putChunk(OWNER, s.getUploadId(), 1, slice(file, 1, 5 * MB));
        ChunkReceipt r0 = chunkStore.putChunk(OWNER, s.getUploadId(), 0, slice(file, 0, 5 * MB));

        assertThat(r0.getReceived()).isEqualTo(3);
        assertThat(r0.getStatus()).isEqualTo(UploadSessionStatus.COMPLETE);
        assertThat(r0.isCompletedSession()).isTrue();

        // 3) Finalize liefert die Bytes in Index-Reihenfolge
        byte[] assembled = chunkStore.finalizeUpload(OWNER, s.getUploadId());
        assertThat(assembled).isEqualTo(file);
        assertThat(chunkStore.get(OWNER, s.getUploadId()).getBufferedChunkCount()).isZero();
    }

    @Test
    void identical_resubmission_is_a_noop() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 10, 4, options(), null);

        ChunkReceipt first = chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcd".getBytes());
        ChunkReceipt again = chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcd".getBytes());

        assertThat(first.isAccepted()).isTrue();
        assertThat(again.isAccepted()).isFalse();
        assertThat(again.getReceived()).isEqualTo(1);
        assertThat(chunkStore.get(OWNER, s.getUploadId()).getMissingChunks()).containsExactly(1, 2);
    }

    @Test
    void resubmission_with_different_content_is_a_conflict() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 10, 4, options(), null);
        chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcd".getBytes());

        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcx".getBytes()), ErrorCode.CHUNK_CONFLICT);
        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 0, "ab".getBytes()), ErrorCode.CHUNK_CONFLICT);
    }

    @Test
    void concurrent_chunks_with_duplicates_complete_the_session_exactly_once() throws Exception {

        // 1) 10 Chunks à 4 Bytes, jeder Chunk wird dreimal gleichzeitig gesendet
        byte[] file = pattern(40);
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", file.length, 4, options(), null);
        Queue<ChunkReceipt> receipts = new ConcurrentLinkedQueue<>();
        CountDownLatch startGate = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int round = 0; round < 3; round++) {
                for (int i = 0; i < s.getTotalChunks(); i++) {
                    int index = i;
                    futures.add(pool.submit(() -> {
                        startGate.await();
                        receipts.add(chunkStore.putChunk(OWNER, s.getUploadId(), index, slice(file, index, 4)));
                        return null;
                    }));
                }
            }

            // 2) alle gleichzeitig loslassen; verschiedene Indizes kollidieren nie
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // 3) genau ein Receipt pro Index angenommen, genau einer vervollständigt die Session
        assertThat(receipts).hasSize(30);
        assertThat(receipts.stream().filter(ChunkReceipt::isAccepted).map(ChunkReceipt::getIndex))
                .containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(receipts.stream().filter(ChunkReceipt::isCompletedSession)).hasSize(1);
        assertThat(chunkStore.get(OWNER, s.getUploadId()).getStatus()).isEqualTo(UploadSessionStatus.COMPLETE);
        assertThat(chunkStore.finalizeUpload(OWNER, s.getUploadId())).isEqualTo(file);
    }

    @Test
    void concurrent_different_content_for_the_same_index_yields_one_conflict() throws Exception {

        for (int attempt = 0; attempt < 20; attempt++) {
            UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 8, 4, options(), null);
            CountDownLatch startGate = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            Queue<ChunkReceipt> receipts = new ConcurrentLinkedQueue<>();
            Queue<ErrorCode> errors = new ConcurrentLinkedQueue<>();
            List<Future<?>> futures = new ArrayList<>();

            try {
                for (String content : List.of("abcd", "abcx")) {
                    futures.add(pool.submit(() -> {
                        startGate.await();
                        try {
                            receipts.add(chunkStore.putChunk(OWNER, s.getUploadId(), 0, content.getBytes()));
                        } catch (ApiException e) {
                            errors.add(e.getErrorCode());
                        }
                        return null;
                    }));
                }
                startGate.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            // der Gewinner bestimmt den Inhalt, der Verlierer scheitert am Inhaltsvergleich
            assertThat(receipts).hasSize(1);
            assertThat(receipts.peek().isAccepted()).isTrue();
            assertThat(errors).containsExactly(ErrorCode.CHUNK_CONFLICT);
            assertThat(chunkStore.get(OWNER, s.getUploadId()).getReceivedCount()).isEqualTo(1);
        }
    }

    @Test
    void index_outside_range_and_wrong_length_are_rejected() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 10, 4, options(), null);

        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 3, "ab".getBytes()), ErrorCode.CHUNK_OUT_OF_RANGE);
        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), -1, "ab".getBytes()), ErrorCode.CHUNK_OUT_OF_RANGE);
        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abc".getBytes()), ErrorCode.CHUNK_SIZE_MISMATCH);
        // letzter Chunk trägt den Rest (2 Bytes)
        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 2, "abcd".getBytes()), ErrorCode.CHUNK_SIZE_MISMATCH);

        assertThat(chunkStore.putChunk(OWNER, s.getUploadId(), 2, "ij".getBytes()).isAccepted()).isTrue();
    }

    @Test
    void finalize_requires_all_chunks_and_happens_once() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 6, 4, options(), null);
        chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcd".getBytes());

        assertError(() -> chunkStore.finalizeUpload(OWNER, s.getUploadId()), ErrorCode.UPLOAD_INCOMPLETE);

        chunkStore.putChunk(OWNER, s.getUploadId(), 1, "ef".getBytes());
        assertThat(new String(chunkStore.finalizeUpload(OWNER, s.getUploadId()))).isEqualTo("abcdef");

        assertError(() -> chunkStore.finalizeUpload(OWNER, s.getUploadId()), ErrorCode.UPLOAD_ALREADY_FINALIZED);

        // nach dem Finalize zählt nur noch die Länge
        assertThat(chunkStore.putChunk(OWNER, s.getUploadId(), 1, "ef".getBytes()).isAccepted()).isFalse();
        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 1, "e".getBytes()), ErrorCode.CHUNK_CONFLICT);
    }

    @Test
    void idle_session_expires() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 8, 4, options(), null);
        chunkStore.putChunk(OWNER, s.getUploadId(), 0, "abcd".getBytes());

        clock.advance(Duration.ofHours(2).plusSeconds(1));

        assertError(() -> chunkStore.putChunk(OWNER, s.getUploadId(), 1, "efgh".getBytes()), ErrorCode.UPLOAD_EXPIRED);
        UploadSession expired = chunkStore.get(OWNER, s.getUploadId());
        assertThat(expired.getStatus()).isEqualTo(UploadSessionStatus.EXPIRED);
        assertThat(expired.getBufferedChunkCount()).isZero();
    }

    @Test
    void sweep_expires_idle_sessions_and_removes_finalized_ones() {
        UploadSession idle = chunkStore.initUpload(OWNER, "idle.txt", "text/plain", 8, 4, options(), null);
        UploadSession done = chunkStore.initUpload(OWNER, "done.txt", "text/plain", 4, 4, options(), null);
        chunkStore.putChunk(OWNER, done.getUploadId(), 0, "abcd".getBytes());
        chunkStore.finalizeUpload(OWNER, done.getUploadId());

        // 1) nach Ablauf der Retention: finalisierte Session weg, idle Session noch da
        clock.advance(Duration.ofMinutes(11));
        assertThat(chunkStore.sweep()).isEqualTo(1);
        assertThat(repository.find(done.getUploadId())).isEmpty();
        assertThat(repository.find(idle.getUploadId())).isPresent();

        // 2) nach Idle-Timeout: EXPIRED
        clock.advance(Duration.ofHours(2));
        chunkStore.sweep();
        assertThat(repository.find(idle.getUploadId()).orElseThrow().getStatus()).isEqualTo(UploadSessionStatus.EXPIRED);
    }

    @Test
    void sessions_of_other_users_are_not_visible() {
        UploadSession s = chunkStore.initUpload(OWNER, "a.txt", "text/plain", 4, 4, options(), null);

        assertError(() -> chunkStore.get("someone-else", s.getUploadId()), ErrorCode.NOT_FOUND);
        assertError(() -> chunkStore.putChunk("someone-else", s.getUploadId(), 0, "abcd".getBytes()), ErrorCode.NOT_FOUND);
    }

    @Test
    void init_validates_metadata() {
        assertError(() -> chunkStore.initUpload(OWNER, "", "text/plain", 4, null, options(), null), ErrorCode.VALIDATION_FAILED);
        assertError(() -> chunkStore.initUpload(OWNER, "a.png", "image/png", 4, null, options(), null), ErrorCode.VALIDATION_FAILED);
        assertError(() -> chunkStore.initUpload(OWNER, "a.txt", "text/plain", 0, null, options(), null), ErrorCode.VALIDATION_FAILED);
        assertError(() -> chunkStore.initUpload(OWNER, "a.txt", "text/plain", 501L * MB, null, options(), null), ErrorCode.VALIDATION_FAILED);
        assertError(() -> chunkStore.initUpload(OWNER, "a.txt", "text/plain", 4, 0, options(), null), ErrorCode.VALIDATION_FAILED);

        // Content-Type aus der Dateiendung
        UploadSession s = chunkStore.initUpload(OWNER, "a.pdf", "application/octet-stream", 4, null, options(), null);
        assertThat(s.getContentType()).isEqualTo("application/pdf");
    }

    private static ProcessingOptions options() {
        return ProcessingOptions.builder().chunkSize(100).overlap(10).build();
    }

    private static byte[] pattern(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i % 251);
        }
        return bytes;
    }

    private static byte[] slice(byte[] file, int index, int chunkSize) {
        int from = index * chunkSize;
        return Arrays.copyOfRange(file, from, Math.min(file.length, from + chunkSize));
    }

    private static void assertError(Runnable call, ErrorCode expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(expected);
    }
}
