package io.github.orbit.persistence.repository;

import io.github.orbit.persistence.document.ScanLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ScanLogRepository extends MongoRepository<ScanLogDocument, String> {
    List<ScanLogDocument> findByScanIdOrderByTimestampAsc(String scanId);
}
