package com.github.spud.worksession.domain.session;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory token and activity counters per session. Nothing here touches the session store;
 * the counters reach the database once, when the session is finalized.
 * <p>
 * Recording against a session that is not tracked returns {@code false} and changes nothing, so
 * a late event for an ended session cannot resurrect its entry.
 */
@Slf4j
@Component
public class ActivityAccumulator {

  private final Map<UUID, Counters> counters = new ConcurrentHashMap<>();

  /**
   * Start tracking a session. No-op when it is already tracked.
   */
  public void track(UUID sessionId) {
    counters.putIfAbsent(sessionId, new Counters());
  }

  public boolean isTracking(UUID sessionId) {
    return counters.containsKey(sessionId);
  }

  public boolean recordTokenUsage(UUID sessionId, long inputTokens, long outputTokens) {
    if (inputTokens < 0 || outputTokens < 0) {
      throw new IllegalArgumentException(
        "Token counts must be non-negative: input=" + inputTokens + ", output=" + outputTokens);
    }
    Counters c = counters.get(sessionId);
    if (c == null) {
      return false;
    }
    c.addTokens(inputTokens, outputTokens);
    log.debug("Session {} tokens +{} input, +{} output", sessionId, inputTokens, outputTokens);
    return true;
  }

  public boolean recordTaskCreated(UUID sessionId) {
    Counters c = counters.get(sessionId);
    if (c == null) {
      return false;
    }
    c.taskCreated();
    return true;
  }

  public boolean recordTaskUpdated(UUID sessionId, boolean completed) {
    Counters c = counters.get(sessionId);
    if (c == null) {
      return false;
    }
    c.taskUpdated(completed);
    return true;
  }

  public boolean recordContextCreated(UUID sessionId) {
    Counters c = counters.get(sessionId);
    if (c == null) {
      return false;
    }
    c.contextCreated();
    return true;
  }

  /**
   * Current values; zeros for an untracked session
   */
  public SessionCounts snapshot(UUID sessionId) {
    Counters c = counters.get(sessionId);
    return c == null ? SessionCounts.EMPTY : c.snapshot();
  }

  /**
   * Drop the entry, after its counters were written durably
   */
  public void clear(UUID sessionId) {
    counters.remove(sessionId);
  }

  /**
   * Mutations and snapshots share one monitor so a snapshot never sees input and output from
   * different updates.
   */
  private static final class Counters {

    private long inputTokens;
    private long outputTokens;
    private int tasksCreated;
    private int tasksUpdated;
    private int tasksCompleted;
    private int contextsCreated;

    synchronized void addTokens(long input, long output) {
      inputTokens = Math.addExact(inputTokens, input);
      outputTokens = Math.addExact(outputTokens, output);
    }

    synchronized void taskCreated() {
      tasksCreated++;
    }

    synchronized void taskUpdated(boolean completed) {
      tasksUpdated++;
      if (completed) {
        tasksCompleted++;
      }
    }

    synchronized void contextCreated() {
      contextsCreated++;
    }

    synchronized SessionCounts snapshot() {
      return new SessionCounts(
        TokenCounts.of(inputTokens, outputTokens),
        new ActivityCounts(tasksCreated, tasksUpdated, tasksCompleted, contextsCreated));
    }
  }
}
