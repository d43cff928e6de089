package de.jwiegmann.trainingdata.control.batch;

import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import de.jwiegmann.trainingdata.entity.Job;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Prozessweites Register jobId -> Job-Snapshot.
 * Updates eines Jobs laufen serialisiert (ConcurrentHashMap#compute), Updates verschiedener Jobs unabhängig.
 * Lesende Zugriffe sehen immer einen vollständigen, unveränderlichen Snapshot und blockieren nie.
 */
@Component
public class JobStatusStore {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    public Job create(Job job) {
        if (jobs.putIfAbsent(job.getJobId(), job) != null) {
            throw new IllegalStateException("job " + job.getJobId() + " already exists");
        }
        return job;
    }

    /**
     * Snapshot eines Jobs des Owners; fremde Jobs sind nicht sichtbar.
     */
    public Job get(String jobId, String ownerId) {
        return find(jobId)
                .filter(j -> j.getOwnerId().equals(ownerId))
                .orElseThrow(() -> UploadErrorFactory.jobNotFound(jobId));
    }

    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Wendet den Mutator atomar auf den aktuellen Snapshot an. Der Mutator muss kurz und seiteneffektfrei sein.
     *
     * @return der neue Snapshot
     */
    public Job update(String jobId, UnaryOperator<Job> mutator) {
        Job updated = jobs.computeIfPresent(jobId, (id, current) -> mutator.apply(current));
        if (updated == null) {
            throw UploadErrorFactory.jobNotFound(jobId);
        }
        return updated;
    }

    public Optional<Job> findByBatchProjectId(String batchProjectId, String ownerId) {
        return jobs.values().stream()
                .filter(j -> j.getBatchProjectId().equals(batchProjectId) && j.getOwnerId().equals(ownerId))
                .findFirst();
    }

    public List<Job> findByOwner(String ownerId) {
        return jobs.values().stream()
                .filter(j -> j.getOwnerId().equals(ownerId))
                .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Entfernt terminale Jobs, die vor {@code cutoff} fertig wurden.
     *
     * @return die entfernten Job-IDs
     */
    public List<String> evictFinishedBefore(Instant cutoff) {
        List<String> evicted = jobs.values().stream()
                .filter(j -> j.isTerminal() && j.getFinishedAt() != null && j.getFinishedAt().isBefore(cutoff))
                .map(Job::getJobId)
                .toList();
        evicted.forEach(jobs::remove);
        return evicted;
    }
}
