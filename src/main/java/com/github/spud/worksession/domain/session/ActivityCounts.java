package com.github.spud.worksession.domain.session;

/**
 * Task and context activity of a session
 */
public record ActivityCounts(int tasksCreated, int tasksUpdated, int tasksCompleted,
                             int contextsCreated) {

  public static final ActivityCounts ZERO = new ActivityCounts(0, 0, 0, 0);
}
