package com.github.spud.worksession.domain.session;

import java.time.OffsetDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * All fields written by the single durable write that closes a session
 */
@Value
@Builder
public class SessionFinalization {

  OffsetDateTime endedAt;

  SessionStatus status;

  SessionCounts counts;

  double productivityScore;

  /**
   * Merged into the existing metadata
   */
  Map<String, Object> metadataPatch;
}
