package io.github.orbit.persistence.repository;

import io.github.orbit.persistence.document.ApiKeyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ApiKeyRepository extends MongoRepository<ApiKeyDocument, String> {
    Optional<ApiKeyDocument> findFirstByProviderIdAndKeyTypeOrderByCreatedAtAsc(String providerId, String keyType);
}
