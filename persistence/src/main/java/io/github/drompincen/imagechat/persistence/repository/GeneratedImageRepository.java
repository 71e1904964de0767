package io.github.drompincen.imagechat.persistence.repository;

import io.github.drompincen.imagechat.persistence.document.GeneratedImageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface GeneratedImageRepository extends MongoRepository<GeneratedImageDocument, String> {
    Optional<GeneratedImageDocument> findByImageIdAndSessionId(String imageId, String sessionId);
    List<GeneratedImageDocument> findBySessionIdOrderByCreatedAtAsc(String sessionId);
    void deleteBySessionId(String sessionId);
}
