package com.github.spud.worksession.domain.session;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Status of one session as reported to callers. Counters of an open session come from memory,
 * those of a closed session from the store.
 */
@Value
@Builder
public class SessionStatusView {

  UUID sessionId;

  String trackingKey;

  String agentType;

  SessionStatus status;

  OffsetDateTime startedAt;

  OffsetDateTime endedAt;

  OffsetDateTime lastActivityAt;

  Duration duration;

  TokenCounts tokens;

  ActivityCounts activity;

  UUID projectId;

  /**
   * Read from the project store at request time
   */
  String projectName;

  Double productivityScore;

  String title;

  String description;

  Map<String, Object> metadata;
}
