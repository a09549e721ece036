package com.github.spud.worksession.domain.project;

import com.github.spud.worksession.application.config.SessionTrackingProperties;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces a project id for a new session through an ordered fallback chain:
 * <ol>
 *   <li>explicit project id, if it exists</li>
 *   <li>the caller's current project</li>
 *   <li>the primary project</li>
 *   <li>the system default project, created if absent</li>
 *   <li>a synthesized personal project</li>
 * </ol>
 * Every level re-reads the project store; nothing here is cached between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectResolver {

  private final ProjectStore projectStore;
  private final SessionTrackingProperties properties;

  public ProjectResolution resolve(UUID explicitProjectId, String callerKey) {
    RuntimeException lastFailure = null;

    if (explicitProjectId != null) {
      try {
        Optional<ProjectSummary> explicit = projectStore.getById(explicitProjectId);
        if (explicit.isPresent()) {
          return resolved(explicit.get(), ResolutionLevel.EXPLICIT);
        }
        log.warn("Explicit project {} does not exist, falling back", explicitProjectId);
      } catch (RuntimeException e) {
        log.warn("Explicit project lookup failed: {}", e.getMessage());
        lastFailure = e;
      }
    }

    LevelAttempt current = attempt(ResolutionLevel.CURRENT_PROJECT,
      () -> projectStore.getCurrentForCaller(callerKey));
    if (current.found()) {
      return current.resolution();
    }
    lastFailure = current.failureOr(lastFailure);

    LevelAttempt primary = attempt(ResolutionLevel.PRIMARY_PROJECT, projectStore::getPrimary);
    if (primary.found()) {
      return primary.resolution();
    }
    lastFailure = primary.failureOr(lastFailure);

    String defaultName = properties.getProjects().getSystemDefaultName();
    LevelAttempt systemDefault = attempt(ResolutionLevel.SYSTEM_DEFAULT,
      () -> Optional.ofNullable(projectStore.getOrCreateDefault(defaultName)));
    if (systemDefault.found()) {
      return systemDefault.resolution();
    }
    lastFailure = systemDefault.failureOr(lastFailure);

    String personalName = properties.getProjects().getPersonalProjectName();
    LevelAttempt personal = attempt(ResolutionLevel.PERSONAL_PROJECT,
      () -> Optional.ofNullable(projectStore.createPersonal(personalName)));
    if (personal.found()) {
      return personal.resolution();
    }
    lastFailure = personal.failureOr(lastFailure);

    throw new ProjectResolutionExhaustedException(
      "No project could be resolved or created; project store unavailable", lastFailure);
  }

  /**
   * The project new sessions would currently default to. Queried on every call so a changed
   * primary designation is visible immediately.
   */
  public Optional<ProjectSummary> currentDefaultProject() {
    Optional<ProjectSummary> primary = projectStore.getPrimary();
    if (primary.isPresent()) {
      return primary;
    }
    return projectStore.findByName(properties.getProjects().getSystemDefaultName());
  }

  private LevelAttempt attempt(ResolutionLevel level, Supplier<Optional<ProjectSummary>> lookup) {
    try {
      return lookup.get()
        .filter(p -> p.id() != null && !isNilId(p.id()))
        .map(p -> new LevelAttempt(resolved(p, level), null))
        .orElseGet(() -> new LevelAttempt(null, null));
    } catch (RuntimeException e) {
      log.warn("Project resolution level {} failed, falling back: {}", level.label(),
        e.getMessage());
      return new LevelAttempt(null, e);
    }
  }

  private ProjectResolution resolved(ProjectSummary project, ResolutionLevel level) {
    log.info("Resolved project {} ({}) via {}", project.name(), project.id(), level.label());
    return new ProjectResolution(project.id(), level);
  }

  private static boolean isNilId(UUID id) {
    return id.getMostSignificantBits() == 0L && id.getLeastSignificantBits() == 0L;
  }

  private record LevelAttempt(ProjectResolution resolution, RuntimeException failure) {

    boolean found() {
      return resolution != null;
    }

    RuntimeException failureOr(RuntimeException previous) {
      return failure != null ? failure : previous;
    }
  }
}
