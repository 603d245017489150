package io.github.orbit.persistence.repository;

import io.github.orbit.persistence.document.ScheduledScanDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ScheduledScanRepository extends MongoRepository<ScheduledScanDocument, String> {
    List<ScheduledScanDocument> findByScanId(String scanId);
}
