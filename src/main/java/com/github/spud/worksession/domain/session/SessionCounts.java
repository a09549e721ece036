package com.github.spud.worksession.domain.session;

/**
 * Point-in-time view of the in-memory counters of one session
 */
public record SessionCounts(TokenCounts tokens, ActivityCounts activity) {

  public static final SessionCounts EMPTY = new SessionCounts(TokenCounts.ZERO, ActivityCounts.ZERO);
}
