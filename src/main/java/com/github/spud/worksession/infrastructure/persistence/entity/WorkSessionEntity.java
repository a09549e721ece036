package com.github.spud.worksession.infrastructure.persistence.entity;

import com.github.spud.worksession.domain.session.SessionStatus;
import com.github.spud.worksession.infrastructure.persistence.converter.SessionStatusConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "sessions")
public class WorkSessionEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Size(max = 255)
  @NotNull
  @Column(name = "tracking_key", nullable = false)
  private String trackingKey;

  @NotNull
  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Size(max = 50)
  @NotNull
  @Column(name = "agent_type", nullable = false, length = 50)
  private String agentType;

  @NotNull
  @Column(name = "started_at", nullable = false)
  private OffsetDateTime startedAt;

  @Column(name = "ended_at")
  private OffsetDateTime endedAt;

  @NotNull
  @ColumnDefault("'active'")
  @Convert(converter = SessionStatusConverter.class)
  @Column(name = "status", nullable = false, length = 20)
  private SessionStatus status = SessionStatus.ACTIVE;

  @NotNull
  @Column(name = "last_activity_at", nullable = false)
  private OffsetDateTime lastActivityAt;

  @Size(max = 255)
  @Column(name = "title")
  private String title;

  @Column(name = "description", length = Integer.MAX_VALUE)
  private String description;

  @ColumnDefault("0")
  @Column(name = "input_tokens", nullable = false)
  private long inputTokens;

  @ColumnDefault("0")
  @Column(name = "output_tokens", nullable = false)
  private long outputTokens;

  @ColumnDefault("0")
  @Column(name = "total_tokens", nullable = false)
  private long totalTokens;

  @ColumnDefault("0")
  @Column(name = "tasks_created", nullable = false)
  private int tasksCreated;

  @ColumnDefault("0")
  @Column(name = "tasks_updated", nullable = false)
  private int tasksUpdated;

  @ColumnDefault("0")
  @Column(name = "tasks_completed", nullable = false)
  private int tasksCompleted;

  @ColumnDefault("0")
  @Column(name = "contexts_created", nullable = false)
  private int contextsCreated;

  @Column(name = "productivity_score")
  private Double productivityScore;

  @ColumnDefault("false")
  @Column(name = "counters_flushed", nullable = false)
  private boolean countersFlushed;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", nullable = false)
  private Map<String, Object> metadata;
}
