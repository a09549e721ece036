package com.github.spud.worksession.domain.session;

import java.util.UUID;
import lombok.Getter;

/**
 * A session insert referenced a project that no longer exists (foreign key violation)
 */
@Getter
public class ProjectReferenceViolationException extends RuntimeException {

  private final UUID projectId;

  public ProjectReferenceViolationException(UUID projectId, Throwable cause) {
    super("Project " + projectId + " is not a valid session reference", cause);
    this.projectId = projectId;
  }
}
