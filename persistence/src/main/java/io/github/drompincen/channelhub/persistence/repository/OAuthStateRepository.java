package io.github.drompincen.channelhub.persistence.repository;

import io.github.drompincen.channelhub.persistence.document.OAuthStateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

public interface OAuthStateRepository extends MongoRepository<OAuthStateDocument, String> {
    long deleteByExpiresAtBefore(Instant cutoff);
}
