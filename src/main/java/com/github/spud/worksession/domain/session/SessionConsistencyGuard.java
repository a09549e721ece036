package com.github.spud.worksession.domain.session;

import com.github.spud.worksession.domain.project.ProjectStore;
import com.github.spud.worksession.domain.project.ProjectSummary;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps the in-memory active-session pointers honest against the session store.
 * <ul>
 *   <li>A cached pointer is trusted only after the store confirms the session is still open
 *   under the same key; otherwise it is evicted and the caller falls through to the store.</li>
 *   <li>"Which project is this session in" is always read from the durable row and the project
 *   store, never from a copy held next to the pointer.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionConsistencyGuard {

  private final SessionStore sessionStore;
  private final ProjectStore projectStore;
  private final ActiveSessionRegistry registry;

  /**
   * The open session the pointer for {@code trackingKey} references, or empty when there is no
   * pointer or it was stale (in which case it has been evicted).
   */
  public Optional<WorkSession> validatePointer(String trackingKey) {
    Optional<UUID> cached = registry.get(trackingKey);
    if (cached.isEmpty()) {
      return Optional.empty();
    }
    UUID sessionId = cached.get();
    Optional<WorkSession> open = sessionStore.findOpenById(sessionId)
      .filter(s -> trackingKey.equals(s.getTrackingKey()));
    if (open.isPresent()) {
      return open;
    }
    if (registry.evict(trackingKey, sessionId)) {
      log.debug("Stale active-session pointer evicted: key={}, session={}", trackingKey,
        sessionId);
    }
    return Optional.empty();
  }

  /**
   * Project of a session, re-read from the store on every call
   */
  public Optional<ProjectSummary> projectForSession(UUID sessionId) {
    return sessionStore.findById(sessionId)
      .map(WorkSession::getProjectId)
      .flatMap(projectStore::getById);
  }
}
