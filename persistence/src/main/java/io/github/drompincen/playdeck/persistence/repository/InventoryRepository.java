package io.github.drompincen.playdeck.persistence.repository;

import io.github.drompincen.playdeck.persistence.document.InventoryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface InventoryRepository extends MongoRepository<InventoryDocument, String> {
    List<InventoryDocument> findAllByOrderByNameAsc();
}
