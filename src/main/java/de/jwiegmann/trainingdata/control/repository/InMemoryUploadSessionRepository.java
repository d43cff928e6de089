package de.jwiegmann.trainingdata.control.repository;

import de.jwiegmann.trainingdata.entity.UploadSession;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryUploadSessionRepository implements UploadSessionRepository {

    private final Map<String, UploadSession> store = new ConcurrentHashMap<>();

    @Override
    public UploadSession save(UploadSession uploadSession) {
        store.put(uploadSession.getUploadId(), uploadSession);
        return uploadSession;
    }

    @Override
    public Optional<UploadSession> find(String uploadId) {
        return Optional.ofNullable(store.get(uploadId));
    }

    @Override
    public List<UploadSession> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public void delete(String uploadId) {
        store.remove(uploadId);
    }
}
