package de.jwiegmann.trainingdata.control.batch;

import de.jwiegmann.trainingdata.entity.TrainingRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Ergebnisse pro Job, indiziert über die Position des Dokuments im Batch.
 * Jeder Worker schreibt nur seinen eigenen Slot.
 */
@Component
public class BatchResultStore {

    private final Map<String, AtomicReferenceArray<List<TrainingRecord>>> results = new ConcurrentHashMap<>();

    public void allocate(String jobId, int documentCount) {
        results.put(jobId, new AtomicReferenceArray<>(documentCount));
    }

    public void put(String jobId, int position, List<TrainingRecord> records) {
        AtomicReferenceArray<List<TrainingRecord>> slots = results.get(jobId);
        if (slots == null) {
            throw new IllegalStateException("no result slots allocated for job " + jobId);
        }
        slots.set(position, List.copyOf(records));
    }

    /**
     * Alle Records in Einreichungsreihenfolge der Dokumente; Dokumente ohne Ergebnis werden übersprungen.
     */
    public List<TrainingRecord> collect(String jobId) {
        AtomicReferenceArray<List<TrainingRecord>> slots = results.get(jobId);
        List<TrainingRecord> all = new ArrayList<>();
        if (slots == null) {
            return all;
        }
        for (int i = 0; i < slots.length(); i++) {
            List<TrainingRecord> slot = slots.get(i);
            if (slot != null) {
                all.addAll(slot);
            }
        }
        return all;
    }

    public void remove(String jobId) {
        results.remove(jobId);
    }
}
