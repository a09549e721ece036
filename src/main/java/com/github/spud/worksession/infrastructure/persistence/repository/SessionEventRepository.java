package com.github.spud.worksession.infrastructure.persistence.repository;

import com.github.spud.worksession.infrastructure.persistence.entity.SessionEventEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionEventRepository extends JpaRepository<SessionEventEntity, Long> {

  List<SessionEventEntity> findBySessionIdOrderByOccurredAtAsc(UUID sessionId);
}
