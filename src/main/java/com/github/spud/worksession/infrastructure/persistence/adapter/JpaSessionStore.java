package com.github.spud.worksession.infrastructure.persistence.adapter;

import com.github.spud.worksession.domain.session.ActivityCounts;
import com.github.spud.worksession.domain.session.ProjectReferenceViolationException;
import com.github.spud.worksession.domain.session.SessionCounts;
import com.github.spud.worksession.domain.session.SessionFinalization;
import com.github.spud.worksession.domain.session.SessionStore;
import com.github.spud.worksession.domain.session.TokenCounts;
import com.github.spud.worksession.domain.session.WorkSession;
import com.github.spud.worksession.infrastructure.persistence.entity.WorkSessionEntity;
import com.github.spud.worksession.infrastructure.persistence.repository.WorkSessionRepository;
import com.github.spud.worksession.infrastructure.util.JsonUtils;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

  private static final String PROJECT_FK = "fk_sessions_project";

  private final WorkSessionRepository repository;

  @Override
  public WorkSession insert(WorkSession session) {
    try {
      return toDomain(repository.saveAndFlush(toEntity(session)));
    } catch (DataIntegrityViolationException e) {
      String detail = String.valueOf(e.getMostSpecificCause().getMessage());
      if (detail.contains(PROJECT_FK)) {
        throw new ProjectReferenceViolationException(session.getProjectId(), e);
      }
      throw e;
    }
  }

  @Override
  public Optional<WorkSession> findById(UUID sessionId) {
    return repository.findById(sessionId).map(this::toDomain);
  }

  @Override
  public Optional<WorkSession> findOpenById(UUID sessionId) {
    return repository.findOpenById(sessionId).map(this::toDomain);
  }

  @Override
  public Optional<WorkSession> findMostRecentOpenByKey(String trackingKey) {
    return repository.findMostRecentOpenByKey(trackingKey).map(this::toDomain);
  }

  @Override
  public boolean finalizeIfActive(UUID sessionId, SessionFinalization finalization) {
    TokenCounts tokens = finalization.getCounts().tokens();
    ActivityCounts activity = finalization.getCounts().activity();
    int updated = repository.finalizeIfActive(sessionId,
      finalization.getStatus().dbValue(),
      finalization.getEndedAt(),
      tokens.input(),
      tokens.output(),
      activity.tasksCreated(),
      activity.tasksUpdated(),
      activity.tasksCompleted(),
      activity.contextsCreated(),
      finalization.getProductivityScore(),
      JsonUtils.toJsonObject(finalization.getMetadataPatch()));
    return updated == 1;
  }

  @Override
  public boolean flushCountersIfPending(UUID sessionId, SessionCounts counts,
    double productivityScore) {
    int updated = repository.flushCountersIfPending(sessionId,
      counts.tokens().input(),
      counts.tokens().output(),
      counts.activity().tasksCreated(),
      counts.activity().tasksUpdated(),
      counts.activity().tasksCompleted(),
      counts.activity().contextsCreated(),
      productivityScore);
    return updated == 1;
  }

  @Override
  public boolean touchActivity(UUID sessionId, OffsetDateTime at) {
    return repository.touchActivity(sessionId, at) == 1;
  }

  @Override
  public boolean assignProject(UUID sessionId, UUID projectId, Map<String, Object> metadataPatch) {
    return repository.assignProject(sessionId, projectId,
      JsonUtils.toJsonObject(metadataPatch)) == 1;
  }

  @Override
  public boolean updateDetails(UUID sessionId, String title, String description,
    Map<String, Object> metadataPatch) {
    return repository.updateDetails(sessionId, title, description,
      JsonUtils.toJsonObject(metadataPatch)) == 1;
  }

  @Override
  @Transactional
  public List<UUID> timeoutIdleSessions(OffsetDateTime idleBefore, OffsetDateTime endedAt) {
    Map<String, Object> patch = Map.of(
      "ended_reason", "timeout",
      "end_time", endedAt.toString(),
      "idle_before", idleBefore.toString());
    return repository.timeoutIdleSessions(idleBefore, endedAt, JsonUtils.toJson(patch));
  }

  private WorkSessionEntity toEntity(WorkSession session) {
    WorkSessionEntity entity = new WorkSessionEntity();
    entity.setId(session.getId());
    entity.setTrackingKey(session.getTrackingKey());
    entity.setProjectId(session.getProjectId());
    entity.setAgentType(session.getAgentType());
    entity.setStartedAt(session.getStartedAt());
    entity.setEndedAt(session.getEndedAt());
    entity.setStatus(session.getStatus());
    entity.setLastActivityAt(session.getLastActivityAt());
    entity.setTitle(session.getTitle());
    entity.setDescription(session.getDescription());
    entity.setInputTokens(session.getTokens().input());
    entity.setOutputTokens(session.getTokens().output());
    entity.setTotalTokens(session.getTokens().total());
    entity.setTasksCreated(session.getActivity().tasksCreated());
    entity.setTasksUpdated(session.getActivity().tasksUpdated());
    entity.setTasksCompleted(session.getActivity().tasksCompleted());
    entity.setContextsCreated(session.getActivity().contextsCreated());
    entity.setProductivityScore(session.getProductivityScore());
    entity.setCountersFlushed(session.isCountersFlushed());
    entity.setMetadata(new HashMap<>(session.getMetadata()));
    return entity;
  }

  private WorkSession toDomain(WorkSessionEntity entity) {
    return WorkSession.builder()
      .id(entity.getId())
      .trackingKey(entity.getTrackingKey())
      .projectId(entity.getProjectId())
      .agentType(entity.getAgentType())
      .startedAt(entity.getStartedAt())
      .endedAt(entity.getEndedAt())
      .status(entity.getStatus())
      .lastActivityAt(entity.getLastActivityAt())
      .title(entity.getTitle())
      .description(entity.getDescription())
      .tokens(TokenCounts.of(entity.getInputTokens(), entity.getOutputTokens()))
      .activity(new ActivityCounts(entity.getTasksCreated(), entity.getTasksUpdated(),
        entity.getTasksCompleted(), entity.getContextsCreated()))
      .productivityScore(entity.getProductivityScore())
      .countersFlushed(entity.isCountersFlushed())
      .metadata(entity.getMetadata() != null ? entity.getMetadata() : Map.of())
      .build();
  }
}
