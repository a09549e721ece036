package com.github.spud.worksession.domain.project;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Caller key -> the project the caller has switched to. Holds ids only; existence is checked by
 * the project store on every read.
 */
@Slf4j
@Component
public class CurrentProjectRegistry {

  private final Map<String, UUID> currentProjects = new ConcurrentHashMap<>();

  public void setCurrent(String callerKey, UUID projectId) {
    log.info("Current project for caller {} set to {}", callerKey, projectId);
    currentProjects.put(callerKey, projectId);
  }

  public Optional<UUID> getCurrent(String callerKey) {
    return Optional.ofNullable(currentProjects.get(callerKey));
  }
}
