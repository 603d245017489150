package io.github.orbit.persistence.repository;

import io.github.orbit.persistence.document.ProviderDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProviderRepository extends MongoRepository<ProviderDocument, String> {
}
