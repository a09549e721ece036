package com.github.spud.worksession.infrastructure.persistence.adapter;

import com.github.spud.worksession.domain.session.SessionAuditEvent;
import com.github.spud.worksession.domain.session.SessionAuditLog;
import com.github.spud.worksession.infrastructure.persistence.entity.SessionEventEntity;
import com.github.spud.worksession.infrastructure.persistence.repository.SessionEventRepository;
import java.util.HashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes audit events in their own transaction. A failed write is logged and dropped; it never
 * reaches the lifecycle operation that produced the event.
 */
@Slf4j
@Component
public class JpaSessionAuditLog implements SessionAuditLog {

  private final SessionEventRepository repository;
  private final TransactionTemplate requiresNew;

  public JpaSessionAuditLog(SessionEventRepository repository,
    PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void append(SessionAuditEvent event) {
    try {
      requiresNew.executeWithoutResult(status -> repository.save(toEntity(event)));
    } catch (RuntimeException e) {
      log.warn("Failed to write {} event for session {}: {}", event.getType(),
        event.getSessionId(), e.getMessage());
    }
  }

  private SessionEventEntity toEntity(SessionAuditEvent event) {
    SessionEventEntity entity = new SessionEventEntity();
    entity.setSessionId(event.getSessionId());
    entity.setProjectId(event.getProjectId());
    entity.setEventType(event.getType().name());
    entity.setOccurredAt(event.getOccurredAt());
    entity.setDurationMs(event.getDurationMs());
    entity.setDetails(event.getDetails() != null ? new HashMap<>(event.getDetails())
      : new HashMap<>());
    return entity;
  }
}
