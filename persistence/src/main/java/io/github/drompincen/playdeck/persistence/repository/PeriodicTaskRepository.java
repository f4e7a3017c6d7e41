package io.github.drompincen.playdeck.persistence.repository;

import io.github.drompincen.playdeck.persistence.document.PeriodicTaskDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PeriodicTaskRepository extends MongoRepository<PeriodicTaskDocument, String> {
    Page<PeriodicTaskDocument> findAllByOrderByCreatedAtAsc(Pageable pageable);
    Page<PeriodicTaskDocument> findByProjectIdOrderByCreatedAtAsc(String projectId, Pageable pageable);
    List<PeriodicTaskDocument> findByProjectId(String projectId);
    List<PeriodicTaskDocument> findByInventoryId(String inventoryId);
}
