package io.github.drompincen.imagechat.persistence.repository;

import io.github.drompincen.imagechat.persistence.document.MessageDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface MessageRepository extends MongoRepository<MessageDocument, String> {
    List<MessageDocument> findBySessionIdOrderBySeqAsc(String sessionId);
    List<MessageDocument> findBySessionIdOrderBySeqDesc(String sessionId, Pageable pageable);
    long countBySessionId(String sessionId);
    void deleteBySessionId(String sessionId);
}
