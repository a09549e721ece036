package com.github.spud.worksession.domain.session;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Tracking key -> id of the open session for that key. Holds ids only, never project or
 * session attributes, so there is nothing here that can go stale except the id itself.
 */
@Component
public class ActiveSessionRegistry {

  private final ConcurrentMap<String, UUID> pointers = new ConcurrentHashMap<>();

  public Optional<UUID> get(String trackingKey) {
    return Optional.ofNullable(pointers.get(trackingKey));
  }

  /**
   * Atomically point {@code trackingKey} at {@code sessionId}, but only if it currently points
   * at {@code expected} (null meaning "no pointer").
   */
  public boolean claim(String trackingKey, UUID expected, UUID sessionId) {
    if (expected == null) {
      return pointers.putIfAbsent(trackingKey, sessionId) == null;
    }
    return pointers.replace(trackingKey, expected, sessionId);
  }

  /**
   * Remove the pointer only if it still references {@code sessionId}
   */
  public boolean evict(String trackingKey, UUID sessionId) {
    return pointers.remove(trackingKey, sessionId);
  }

  /**
   * Remove every pointer referencing {@code sessionId}
   */
  public void evictSession(UUID sessionId) {
    pointers.entrySet().removeIf(e -> e.getValue().equals(sessionId));
  }
}
