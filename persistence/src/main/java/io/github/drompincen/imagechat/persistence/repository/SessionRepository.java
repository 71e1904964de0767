package io.github.drompincen.imagechat.persistence.repository;

import io.github.drompincen.imagechat.persistence.document.SessionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
}
