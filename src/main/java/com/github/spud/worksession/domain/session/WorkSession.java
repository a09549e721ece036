package com.github.spud.worksession.domain.session;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable view of a durable session row
 */
@Value
@Builder(toBuilder = true)
public class WorkSession {

  UUID id;

  /**
   * Tracking key the session was started under
   */
  String trackingKey;

  /**
   * Never null once the row exists
   */
  UUID projectId;

  String agentType;

  OffsetDateTime startedAt;

  /**
   * Null while the session is open
   */
  OffsetDateTime endedAt;

  SessionStatus status;

  OffsetDateTime lastActivityAt;

  String title;

  String description;

  @Builder.Default
  TokenCounts tokens = TokenCounts.ZERO;

  @Builder.Default
  ActivityCounts activity = ActivityCounts.ZERO;

  Double productivityScore;

  /**
   * Whether the final counters have been written
   */
  boolean countersFlushed;

  @Singular("metadataEntry")
  Map<String, Object> metadata;

  public boolean isOpen() {
    return status == SessionStatus.ACTIVE && endedAt == null;
  }

  public Duration durationAt(OffsetDateTime now) {
    OffsetDateTime end = endedAt != null ? endedAt : now;
    return Duration.between(startedAt, end);
  }
}
