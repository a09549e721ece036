package com.github.spud.worksession.infrastructure.persistence.repository;

import com.github.spud.worksession.infrastructure.persistence.entity.WorkSessionEntity;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.NativeQuery;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every status change is a single conditional UPDATE; the returned row count tells the caller
 * whether it won.
 */
public interface WorkSessionRepository extends JpaRepository<WorkSessionEntity, UUID> {

  @NativeQuery("SELECT * FROM sessions WHERE id = :id AND status = 'active' AND ended_at IS NULL")
  Optional<WorkSessionEntity> findOpenById(@Param("id") UUID id);

  @NativeQuery("""
    SELECT * FROM sessions
    WHERE tracking_key = :trackingKey AND status = 'active' AND ended_at IS NULL
    ORDER BY started_at DESC
    LIMIT 1
    """)
  Optional<WorkSessionEntity> findMostRecentOpenByKey(@Param("trackingKey") String trackingKey);

  @Transactional
  @Modifying
  @NativeQuery("""
    UPDATE sessions SET
      status = :status,
      ended_at = :endedAt,
      input_tokens = :inputTokens,
      output_tokens = :outputTokens,
      total_tokens = :inputTokens + :outputTokens,
      tasks_created = :tasksCreated,
      tasks_updated = :tasksUpdated,
      tasks_completed = :tasksCompleted,
      contexts_created = :contextsCreated,
      productivity_score = :score,
      counters_flushed = TRUE,
      metadata = metadata || CAST(:patch AS jsonb)
    WHERE id = :id AND status = 'active' AND ended_at IS NULL
    """)
  int finalizeIfActive(@Param("id") UUID id,
    @Param("status") String status,
    @Param("endedAt") OffsetDateTime endedAt,
    @Param("inputTokens") long inputTokens,
    @Param("outputTokens") long outputTokens,
    @Param("tasksCreated") int tasksCreated,
    @Param("tasksUpdated") int tasksUpdated,
    @Param("tasksCompleted") int tasksCompleted,
    @Param("contextsCreated") int contextsCreated,
    @Param("score") double score,
    @Param("patch") String patch);

  @Transactional
  @Modifying
  @NativeQuery("""
    UPDATE sessions SET
      input_tokens = :inputTokens,
      output_tokens = :outputTokens,
      total_tokens = :inputTokens + :outputTokens,
      tasks_created = :tasksCreated,
      tasks_updated = :tasksUpdated,
      tasks_completed = :tasksCompleted,
      contexts_created = :contextsCreated,
      productivity_score = :score,
      counters_flushed = TRUE
    WHERE id = :id AND status <> 'active' AND counters_flushed = FALSE
    """)
  int flushCountersIfPending(@Param("id") UUID id,
    @Param("inputTokens") long inputTokens,
    @Param("outputTokens") long outputTokens,
    @Param("tasksCreated") int tasksCreated,
    @Param("tasksUpdated") int tasksUpdated,
    @Param("tasksCompleted") int tasksCompleted,
    @Param("contextsCreated") int contextsCreated,
    @Param("score") double score);

  @Transactional
  @Modifying
  @NativeQuery("""
    UPDATE sessions SET last_activity_at = GREATEST(last_activity_at, :at)
    WHERE id = :id AND status = 'active' AND ended_at IS NULL
    """)
  int touchActivity(@Param("id") UUID id, @Param("at") OffsetDateTime at);

  @Transactional
  @Modifying
  @NativeQuery("""
    UPDATE sessions SET
      project_id = :projectId,
      metadata = metadata || CAST(:patch AS jsonb)
    WHERE id = :id AND status = 'active' AND ended_at IS NULL
    """)
  int assignProject(@Param("id") UUID id, @Param("projectId") UUID projectId,
    @Param("patch") String patch);

  @Transactional
  @Modifying
  @NativeQuery("""
    UPDATE sessions SET
      title = COALESCE(CAST(:title AS varchar), title),
      description = COALESCE(CAST(:description AS text), description),
      metadata = metadata || CAST(:patch AS jsonb)
    WHERE id = :id AND status = 'active' AND ended_at IS NULL
    """)
  int updateDetails(@Param("id") UUID id, @Param("title") String title,
    @Param("description") String description, @Param("patch") String patch);

  /**
   * Bulk idle transition. Runs as a query because of the RETURNING clause, so it needs a
   * read-write transaction from the caller.
   */
  @NativeQuery("""
    UPDATE sessions SET
      status = 'inactive',
      ended_at = :endedAt,
      metadata = metadata || CAST(:patch AS jsonb)
    WHERE status = 'active'
      AND ended_at IS NULL
      AND last_activity_at < :idleBefore
    RETURNING id
    """)
  List<UUID> timeoutIdleSessions(@Param("idleBefore") OffsetDateTime idleBefore,
    @Param("endedAt") OffsetDateTime endedAt, @Param("patch") String patch);
}
