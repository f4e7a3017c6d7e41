package io.github.drompincen.playdeck.persistence.repository;

import io.github.drompincen.playdeck.persistence.document.TypesPermissionsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TypesPermissionsRepository extends MongoRepository<TypesPermissionsDocument, String> {
    List<TypesPermissionsDocument> findByUserId(String userId);
    List<TypesPermissionsDocument> findByPeriodicTaskIdsContaining(String periodicTaskId);
}
