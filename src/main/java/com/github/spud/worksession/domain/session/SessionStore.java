package com.github.spud.worksession.domain.session;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable session storage. This is the only locking and transaction boundary of the tracker:
 * every mutating operation is a single conditional statement, so concurrent writers race
 * benignly and the loser's write affects no row.
 */
public interface SessionStore {

  /**
   * Insert a new open session.
   *
   * @throws ProjectReferenceViolationException if the project id does not reference an existing
   *                                            project
   */
  WorkSession insert(WorkSession session);

  Optional<WorkSession> findById(UUID sessionId);

  /**
   * The session, only if it is still active with no end timestamp
   */
  Optional<WorkSession> findOpenById(UUID sessionId);

  /**
   * Most recently started open session for a tracking key
   */
  Optional<WorkSession> findMostRecentOpenByKey(String trackingKey);

  /**
   * Close the session with its final counters, guarded by {@code status = active}.
   *
   * @return false when the session was not active (already ended, timed out or missing)
   */
  boolean finalizeIfActive(UUID sessionId, SessionFinalization finalization);

  /**
   * Write the counters of a session that was closed without them (timeout), guarded by
   * {@code counters_flushed = false}.
   *
   * @return false when the counters were already written
   */
  boolean flushCountersIfPending(UUID sessionId, SessionCounts counts, double productivityScore);

  /**
   * @return false when the session is not active
   */
  boolean touchActivity(UUID sessionId, OffsetDateTime at);

  /**
   * @return false when the session is not active
   */
  boolean assignProject(UUID sessionId, UUID projectId, Map<String, Object> metadataPatch);

  /**
   * Null title or description leaves the stored value unchanged.
   *
   * @return false when the session is not active
   */
  boolean updateDetails(UUID sessionId, String title, String description,
    Map<String, Object> metadataPatch);

  /**
   * Atomically move every active session idle since before {@code idleBefore} to inactive.
   *
   * @return ids of the sessions this call transitioned
   */
  List<UUID> timeoutIdleSessions(OffsetDateTime idleBefore, OffsetDateTime endedAt);
}
