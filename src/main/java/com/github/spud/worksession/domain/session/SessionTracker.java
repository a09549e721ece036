package com.github.spud.worksession.domain.session;

import com.github.spud.worksession.application.config.SessionTrackingProperties;
import com.github.spud.worksession.domain.project.CurrentProjectRegistry;
import com.github.spud.worksession.domain.project.ProjectNotFoundException;
import com.github.spud.worksession.domain.project.ProjectResolution;
import com.github.spud.worksession.domain.project.ProjectResolutionExhaustedException;
import com.github.spud.worksession.domain.project.ProjectResolver;
import com.github.spud.worksession.domain.project.ProjectStore;
import com.github.spud.worksession.domain.project.ProjectSummary;
import com.github.spud.worksession.domain.state.SessionLifecycleStateMachine;
import com.github.spud.worksession.domain.state.SessionTransition;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Session lifecycle: start, resolve the active session of a tracking key, record activity, end.
 * <p>
 * Not transactional itself. Every durable change is one conditional write in the
 * {@link SessionStore}; the in-memory pointer and counters are only ever advanced after the
 * store has confirmed the corresponding row state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTracker {

  private static final int MAX_TEXT_LENGTH = 255;
  private static final int MAX_AGENT_TYPE_LENGTH = 50;

  private final SessionStore sessionStore;
  private final ProjectStore projectStore;
  private final ProjectResolver projectResolver;
  private final CurrentProjectRegistry currentProjects;
  private final ActivityAccumulator accumulator;
  private final ActiveSessionRegistry registry;
  private final SessionConsistencyGuard consistencyGuard;
  private final SessionLifecycleStateMachine stateMachine;
  private final ProductivityCalculator productivityCalculator;
  private final SessionAuditLog auditLog;
  private final SessionTrackingProperties properties;
  private final Clock clock;

  /**
   * Last durable last_activity_at write per session, used to throttle opportunistic touches
   */
  private final Map<UUID, OffsetDateTime> lastDurableTouch = new ConcurrentHashMap<>();

  /**
   * Counters of closed sessions whose flush failed; retried on the next sweep or on any later call
   * for the session.
   */
  private final Map<UUID, SessionCounts> pendingFlushes = new ConcurrentHashMap<>();

  /**
   * Start a new session for the request's tracking key. An open session already pointed to by
   * that key is ended as superseded. When two starts for one key race, exactly one of them
   * becomes the active session and the other returns its id.
   */
  public UUID startSession(StartSessionRequest request) {
    requireMaxLength("trackingKey", request.getTrackingKey(), MAX_TEXT_LENGTH);
    requireMaxLength("title", request.getTitle(), MAX_TEXT_LENGTH);
    requireMaxLength("agentType", request.getAgentType(), MAX_AGENT_TYPE_LENGTH);
    String key = keyOrDefault(request.getTrackingKey());
    Optional<WorkSession> previous = findActive(key);
    WorkSession created = createDurableSession(key, request);
    accumulator.track(created.getId());
    lastDurableTouch.put(created.getId(), created.getStartedAt());

    UUID expected = previous.map(WorkSession::getId).orElse(null);
    while (true) {
      boolean claimed = registry.claim(key, expected, created.getId());
      if (!claimed && registry.get(key).filter(created.getId()::equals).isPresent()) {
        // a concurrent lookup adopted the new row from the store
        claimed = true;
      }
      if (claimed) {
        auditLog.append(SessionAuditEvent.builder()
          .type(SessionAuditEvent.Type.SESSION_START)
          .sessionId(created.getId())
          .projectId(created.getProjectId())
          .occurredAt(created.getStartedAt())
          .details(Map.of(
            "tracking_key", key,
            "agent_type", created.getAgentType(),
            "project_resolution_method",
            created.getMetadata().get("project_resolution_method")))
          .build());
        log.info("Started session {} for key {} in project {}", created.getId(), key,
          created.getProjectId());
        if (expected != null) {
          endSuperseded(expected, created.getId());
        }
        return created.getId();
      }
      Optional<WorkSession> winner = consistencyGuard.validatePointer(key);
      if (winner.isPresent()) {
        discardRaceLoser(created, winner.get().getId());
        return winner.get().getId();
      }
      // the pointer we expected is gone and nobody replaced it; compete for the empty slot
      expected = null;
    }
  }

  public UUID startSession(UUID projectId, String title, String description) {
    return startSession(StartSessionRequest.builder()
      .projectId(projectId)
      .title(title)
      .description(description)
      .build());
  }

  /**
   * Project a new session for {@code trackingKey} would be created in, and how it was found
   */
  public ProjectResolution resolveProjectForSession(UUID explicitProjectId, String trackingKey) {
    return projectResolver.resolve(explicitProjectId, keyOrDefault(trackingKey));
  }

  /**
   * Id of the open session for the tracking key. A cached pointer is validated against the
   * store first; when there is none, the most recent open session in the store is adopted.
   */
  public Optional<UUID> getActiveSession(String trackingKey) {
    return findActive(keyOrDefault(trackingKey)).map(WorkSession::getId);
  }

  /**
   * End an open session. Final counters, end timestamp and productivity score are written in
   * one conditional write.
   *
   * @throws SessionNotFoundException when the session does not exist or is no longer open
   */
  public SessionStatusView endSession(UUID sessionId) {
    return closeSession(sessionId, SessionTransition.END, SessionAuditEvent.Type.SESSION_END,
      Map.of("ended_reason", "explicit"));
  }

  /**
   * Close an open session because its client connection went away
   */
  public SessionStatusView markDisconnected(UUID sessionId, String reason) {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("ended_reason", "disconnected");
    if (StringUtils.hasText(reason)) {
      extra.put("disconnect_reason", reason);
    }
    return closeSession(sessionId, SessionTransition.DISCONNECT,
      SessionAuditEvent.Type.SESSION_DISCONNECT, extra);
  }

  public void recordTokenUsage(UUID sessionId, long inputTokens, long outputTokens) {
    record(sessionId, () -> accumulator.recordTokenUsage(sessionId, inputTokens, outputTokens));
  }

  public void recordTaskCreated(UUID sessionId) {
    record(sessionId, () -> accumulator.recordTaskCreated(sessionId));
  }

  public void recordTaskUpdated(UUID sessionId, boolean completed) {
    record(sessionId, () -> accumulator.recordTaskUpdated(sessionId, completed));
  }

  public void recordContextCreated(UUID sessionId) {
    record(sessionId, () -> accumulator.recordContextCreated(sessionId));
  }

  /**
   * Unconditionally write last_activity_at for an open session
   *
   * @throws SessionNotFoundException when the session is not open
   */
  public void updateSessionActivity(UUID sessionId) {
    OffsetDateTime now = now();
    if (!sessionStore.touchActivity(sessionId, now)) {
      retryPendingFlush(sessionId);
      throw new SessionNotFoundException(sessionId);
    }
    lastDurableTouch.put(sessionId, now);
  }

  /**
   * Move an open session to another project, referenced by id or by name
   *
   * @throws ProjectNotFoundException when the reference matches no project, or several
   */
  public ProjectSummary assignSessionToProject(UUID sessionId, String projectRef) {
    ProjectSummary project = findProject(projectRef);
    WorkSession session = sessionStore.findOpenById(sessionId)
      .orElseThrow(() -> new SessionNotFoundException(sessionId));

    Map<String, Object> patch = new LinkedHashMap<>();
    patch.put("assigned_manually", true);
    patch.put("assigned_at", now().toString());
    patch.put("previous_project_id", String.valueOf(session.getProjectId()));
    if (!sessionStore.assignProject(sessionId, project.id(), patch)) {
      throw new SessionNotFoundException(sessionId);
    }
    log.info("Session {} assigned to project {} ({})", sessionId, project.name(), project.id());
    return project;
  }

  /**
   * Set title and/or description of an open session; null leaves a field unchanged
   */
  public void updateSessionDetails(UUID sessionId, String title, String description) {
    if (title == null && description == null) {
      throw new IllegalArgumentException("Either title or description must be provided");
    }
    requireMaxLength("title", title, MAX_TEXT_LENGTH);
    Map<String, Object> patch = Map.of("details_updated_at", now().toString());
    if (!sessionStore.updateDetails(sessionId, title, description, patch)) {
      throw new SessionNotFoundException(sessionId);
    }
    log.debug("Session {} details updated", sessionId);
  }

  /**
   * Status of any session, open or closed
   */
  public SessionStatusView getSessionStatus(UUID sessionId) {
    WorkSession session = sessionStore.findById(sessionId)
      .orElseThrow(() -> new SessionNotFoundException(sessionId));
    SessionCounts counts = session.isOpen()
      ? accumulator.snapshot(sessionId)
      : new SessionCounts(session.getTokens(), session.getActivity());
    String projectName = consistencyGuard.projectForSession(sessionId)
      .map(ProjectSummary::name)
      .orElse(null);
    return toView(session, counts, projectName, session.durationAt(now()));
  }

  /**
   * Project a session currently belongs to, read durably
   */
  public Optional<ProjectSummary> getProjectForSession(UUID sessionId) {
    return consistencyGuard.projectForSession(sessionId);
  }

  public Optional<ProjectSummary> currentDefaultProject() {
    return projectResolver.currentDefaultProject();
  }

  /**
   * Make a project, referenced by id or by name, the caller's current project. New sessions of
   * that tracking key resolve to it while it exists.
   */
  public ProjectSummary switchCurrentProject(String trackingKey, String projectRef) {
    ProjectSummary project = findProject(projectRef);
    currentProjects.setCurrent(keyOrDefault(trackingKey), project.id());
    return project;
  }

  /**
   * Reconcile in-memory state for sessions the sweeper just timed out: pointers are evicted and
   * counters still held in memory are written to the already closed rows.
   */
  public void onSessionsTimedOut(List<UUID> sessionIds) {
    for (UUID sessionId : sessionIds) {
      WorkSession session = null;
      try {
        session = flushPendingCounters(sessionId)
          .or(() -> sessionStore.findById(sessionId))
          .orElse(null);
      } catch (RuntimeException e) {
        log.warn("Failed to reconcile timed out session {}: {}",
          sessionId, e.getMessage());
      } finally {
        forget(sessionId);
      }
      auditLog.append(SessionAuditEvent.builder()
        .type(SessionAuditEvent.Type.SESSION_TIMEOUT)
        .sessionId(sessionId)
        .projectId(session != null ? session.getProjectId() : null)
        .occurredAt(now())
        .durationMs(session != null && session.getEndedAt() != null
          ? session.durationAt(session.getEndedAt()).toMillis() : null)
        .details(Map.of("ended_reason", "timeout"))
        .build());
    }
  }

  /**
   * Retry counter flushes that failed while reconciling earlier timeouts
   */
  public void retryPendingFlushes() {
    for (UUID sessionId : List.copyOf(pendingFlushes.keySet())) {
      retryPendingFlush(sessionId);
    }
  }

  private SessionStatusView closeSession(UUID sessionId, SessionTransition transition,
    SessionAuditEvent.Type eventType, Map<String, Object> extraMetadata) {
    WorkSession session = sessionStore.findOpenById(sessionId).orElse(null);
    if (session == null) {
      // closed by a sweep or another caller; counters still held here belong on that row
      flushQuietly(sessionId);
      throw new SessionNotFoundException(sessionId);
    }
    SessionStatus target = stateMachine.next(session.getStatus(), transition);

    OffsetDateTime endedAt = now();
    Duration duration = Duration.between(session.getStartedAt(), endedAt);
    SessionCounts counts = accumulator.snapshot(sessionId);
    double score = productivityCalculator.score(counts.activity(), duration);

    Map<String, Object> patch = new LinkedHashMap<>(extraMetadata);
    patch.put("end_time", endedAt.toString());
    patch.put("duration_ms", duration.toMillis());
    patch.put("completed_by", "session-tracker");

    boolean closed = sessionStore.finalizeIfActive(sessionId, SessionFinalization.builder()
      .endedAt(endedAt)
      .status(target)
      .counts(counts)
      .productivityScore(score)
      .metadataPatch(patch)
      .build());
    if (!closed) {
      // timed out between the read and the write; the counters still belong on the row
      flushQuietly(sessionId);
      throw new SessionNotFoundException(sessionId);
    }
    forget(sessionId);

    auditLog.append(SessionAuditEvent.builder()
      .type(eventType)
      .sessionId(sessionId)
      .projectId(session.getProjectId())
      .occurredAt(endedAt)
      .durationMs(duration.toMillis())
      .details(Map.of(
        "total_tokens", counts.tokens().total(),
        "tasks_completed", counts.activity().tasksCompleted(),
        "contexts_created", counts.activity().contextsCreated(),
        "productivity_score", score))
      .build());
    log.info("Session {} closed as {}: duration={}s, tokens={}, tasksCompleted={}, score={}",
      sessionId, target.dbValue(), duration.toSeconds(), counts.tokens().total(),
      counts.activity().tasksCompleted(), score);

    WorkSession closedSession = session.toBuilder()
      .status(target)
      .endedAt(endedAt)
      .productivityScore(score)
      .countersFlushed(true)
      .build();
    String projectName = projectStore.getById(session.getProjectId())
      .map(ProjectSummary::name)
      .orElse(null);
    return toView(closedSession, counts, projectName, duration);
  }

  private void endSuperseded(UUID previousId, UUID replacementId) {
    try {
      closeSession(previousId, SessionTransition.END, SessionAuditEvent.Type.SESSION_END,
        Map.of("ended_reason", "superseded", "superseded_by", replacementId.toString()));
    } catch (SessionNotFoundException e) {
      log.debug("Superseded session {} was already closed", previousId);
    }
  }

  private void discardRaceLoser(WorkSession created, UUID winnerId) {
    log.info("Start race lost for key {}: discarding {} in favour of {}",
      created.getTrackingKey(), created.getId(), winnerId);
    accumulator.clear(created.getId());
    lastDurableTouch.remove(created.getId());
    OffsetDateTime now = now();
    sessionStore.finalizeIfActive(created.getId(), SessionFinalization.builder()
      .endedAt(now)
      .status(SessionStatus.INACTIVE)
      .counts(SessionCounts.EMPTY)
      .productivityScore(0.0)
      .metadataPatch(Map.of(
        "ended_reason", "start_race_lost",
        "superseded_by", winnerId.toString(),
        "end_time", now.toString()))
      .build());
  }

  private WorkSession createDurableSession(String key, StartSessionRequest request) {
    try {
      return sessionStore.insert(newSession(key, request, resolve(request, key)));
    } catch (ProjectReferenceViolationException first) {
      log.warn("Project {} disappeared before session insert, resolving again",
        first.getProjectId());
    } catch (SessionCreationFailedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionCreationFailedException("Session could not be created", e);
    }
    try {
      return sessionStore.insert(newSession(key, request, resolve(request, key)));
    } catch (SessionCreationFailedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionCreationFailedException("Session could not be created", e);
    }
  }

  private ProjectResolution resolve(StartSessionRequest request, String key) {
    try {
      return projectResolver.resolve(request.getProjectId(), key);
    } catch (ProjectResolutionExhaustedException e) {
      throw new SessionCreationFailedException("Session could not be created", e);
    }
  }

  private WorkSession newSession(String key, StartSessionRequest request,
    ProjectResolution resolution) {
    OffsetDateTime now = now();
    return WorkSession.builder()
      .id(UUID.randomUUID())
      .trackingKey(key)
      .projectId(resolution.projectId())
      .agentType(StringUtils.hasText(request.getAgentType()) ? request.getAgentType()
        : properties.getAgentType())
      .startedAt(now)
      .lastActivityAt(now)
      .status(SessionStatus.ACTIVE)
      .title(request.getTitle())
      .description(request.getDescription())
      .metadataEntry("created_by", "session-tracker")
      .metadataEntry("project_resolution_method", resolution.level().label())
      .metadataEntry("title_provided", request.getTitle() != null)
      .build();
  }

  private Optional<WorkSession> findActive(String key) {
    Optional<WorkSession> cached = consistencyGuard.validatePointer(key);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<WorkSession> stored = sessionStore.findMostRecentOpenByKey(key);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    WorkSession session = stored.get();
    accumulator.track(session.getId());
    if (registry.claim(key, null, session.getId())) {
      log.info("Restored active session {} for key {} from the store", session.getId(), key);
      return stored;
    }
    // another caller set the pointer meanwhile; its view wins if still valid
    return consistencyGuard.validatePointer(key).or(() -> stored);
  }

  /**
   * Apply a counter update. A session that is open in the store but not tracked in memory
   * (after a restart, or created by another instance) is adopted once.
   */
  private void record(UUID sessionId, BooleanSupplier update) {
    if (!update.getAsBoolean()) {
      WorkSession open = sessionStore.findOpenById(sessionId).orElse(null);
      if (open == null) {
        retryPendingFlush(sessionId);
        throw new SessionNotFoundException(sessionId);
      }
      accumulator.track(open.getId());
      if (!update.getAsBoolean()) {
        throw new SessionNotFoundException(sessionId);
      }
    }
    touchIfDue(sessionId);
  }

  private void touchIfDue(UUID sessionId) {
    OffsetDateTime now = now();
    OffsetDateTime last = lastDurableTouch.get(sessionId);
    if (last != null
      && Duration.between(last, now).compareTo(properties.getActivityTouchInterval()) < 0) {
      return;
    }
    try {
      if (sessionStore.touchActivity(sessionId, now)) {
        lastDurableTouch.put(sessionId, now);
      }
    } catch (RuntimeException e) {
      // counters are already recorded in memory; a missed touch only ages the idle clock
      log.warn("Failed to update last activity of session {}: {}", sessionId, e.getMessage());
    }
  }

  /**
   * Write counters held in memory, or left over from a failed flush, to the closed row. In-memory
   * state of the session is dropped either way; on failure the counters are kept in
   * {@link #pendingFlushes} and the exception is rethrown.
   */
  private Optional<WorkSession> flushPendingCounters(UUID sessionId) {
    SessionCounts counts = accumulator.isTracking(sessionId)
      ? accumulator.snapshot(sessionId)
      : pendingFlushes.get(sessionId);
    try {
      if (counts == null) {
        return Optional.empty();
      }
      Optional<WorkSession> session = sessionStore.findById(sessionId);
      session.ifPresent(s -> {
        double score = productivityCalculator.score(counts.activity(), s.durationAt(now()));
        if (sessionStore.flushCountersIfPending(sessionId, counts, score)) {
          log.info("Flushed counters of timed out session {}: tokens={}, tasksCompleted={}",
            sessionId, counts.tokens().total(), counts.activity().tasksCompleted());
        }
      });
      pendingFlushes.remove(sessionId);
      return session;
    } catch (RuntimeException e) {
      pendingFlushes.put(sessionId, counts);
      throw e;
    } finally {
      forget(sessionId);
    }
  }

  private void flushQuietly(UUID sessionId) {
    try {
      flushPendingCounters(sessionId);
    } catch (RuntimeException e) {
      log.warn("Failed to flush counters of closed session {}, kept for retry: {}",
        sessionId, e.getMessage());
    }
  }

  private void retryPendingFlush(UUID sessionId) {
    if (pendingFlushes.containsKey(sessionId)) {
      flushQuietly(sessionId);
    }
  }

  boolean hasPendingFlush(UUID sessionId) {
    return pendingFlushes.containsKey(sessionId);
  }

  boolean isThrottlingTouches(UUID sessionId) {
    return lastDurableTouch.containsKey(sessionId);
  }

  private void forget(UUID sessionId) {
    registry.evictSession(sessionId);
    accumulator.clear(sessionId);
    lastDurableTouch.remove(sessionId);
  }

  private ProjectSummary findProject(String projectRef) {
    if (!StringUtils.hasText(projectRef)) {
      throw new IllegalArgumentException("Project reference must not be blank");
    }
    String ref = projectRef.trim();
    UUID projectId = parseUuid(ref);
    if (projectId != null) {
      return projectStore.getById(projectId)
        .orElseThrow(() -> new ProjectNotFoundException("Project not found: " + ref));
    }

    Optional<ProjectSummary> byName = projectStore.findByName(ref);
    if (byName.isPresent()) {
      return byName.get();
    }
    List<ProjectSummary> all = projectStore.listAll();
    Optional<ProjectSummary> exact = all.stream()
      .filter(p -> p.name().equalsIgnoreCase(ref))
      .findFirst();
    if (exact.isPresent()) {
      return exact.get();
    }
    String needle = ref.toLowerCase(Locale.ROOT);
    List<ProjectSummary> partial = all.stream()
      .filter(p -> p.name().toLowerCase(Locale.ROOT).contains(needle))
      .collect(Collectors.toList());
    if (partial.size() == 1) {
      return partial.get(0);
    }
    String available = all.stream().map(ProjectSummary::name).collect(Collectors.joining(", "));
    throw new ProjectNotFoundException(partial.isEmpty()
      ? "Project '" + ref + "' not found. Available projects: " + available
      : "Project '" + ref + "' is ambiguous, matches: " + partial.stream()
        .map(ProjectSummary::name)
        .collect(Collectors.joining(", ")));
  }

  private static UUID parseUuid(String value) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private SessionStatusView toView(WorkSession session, SessionCounts counts, String projectName,
    Duration duration) {
    return SessionStatusView.builder()
      .sessionId(session.getId())
      .trackingKey(session.getTrackingKey())
      .agentType(session.getAgentType())
      .status(session.getStatus())
      .startedAt(session.getStartedAt())
      .endedAt(session.getEndedAt())
      .lastActivityAt(session.getLastActivityAt())
      .duration(duration)
      .tokens(counts.tokens())
      .activity(counts.activity())
      .projectId(session.getProjectId())
      .projectName(projectName)
      .productivityScore(session.getProductivityScore())
      .title(session.getTitle())
      .description(session.getDescription())
      .metadata(session.getMetadata())
      .build();
  }

  private static void requireMaxLength(String field, String value, int max) {
    if (value != null && value.length() > max) {
      throw new IllegalArgumentException(field + " must be at most " + max + " characters");
    }
  }

  private String keyOrDefault(String trackingKey) {
    return StringUtils.hasText(trackingKey) ? trackingKey : properties.getTrackingKey();
  }

  private OffsetDateTime now() {
    return OffsetDateTime.now(clock);
  }

  @Data
  @Builder
  public static class StartSessionRequest {

    private String trackingKey;
    private UUID projectId;
    private String title;
    private String description;
    private String agentType;
  }
}
