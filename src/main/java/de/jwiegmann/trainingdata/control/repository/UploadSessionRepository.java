package de.jwiegmann.trainingdata.control.repository;

import de.jwiegmann.trainingdata.entity.UploadSession;

import java.util.List;
import java.util.Optional;

public interface UploadSessionRepository {

    UploadSession save(UploadSession session);

    Optional<UploadSession> find(String uploadId);

    List<UploadSession> findAll();

    void delete(String uploadId);
}
