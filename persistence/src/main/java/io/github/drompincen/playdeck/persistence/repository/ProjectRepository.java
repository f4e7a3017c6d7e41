package io.github.drompincen.playdeck.persistence.repository;

import io.github.drompincen.playdeck.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    List<ProjectDocument> findAllByOrderByUpdatedAtDesc();
    Optional<ProjectDocument> findByNameIgnoreCase(String name);
}
