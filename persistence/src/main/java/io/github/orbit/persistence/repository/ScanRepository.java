package io.github.orbit.persistence.repository;

import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.protocol.api.ScanStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface ScanRepository extends MongoRepository<ScanDocument, String> {

    /**
     * Scans with no cost yet whose VM lifetime is fully known, excluding the given status
     * (manual scans are never billed).
     */
    @Query("{ 'cost': null, "
            + "'vmStartTime': { $nin: [null, ''] }, "
            + "'vmStopTime': { $nin: [null, ''] }, "
            + "'status': { $ne: ?0 } }")
    List<ScanDocument> findUncostedCompletedScans(ScanStatus excludedStatus, Pageable pageable);
}
