package com.github.spud.worksession.domain.project;

/**
 * Every level of the resolution chain failed. Only possible when the project store is down.
 */
public class ProjectResolutionExhaustedException extends RuntimeException {

  public ProjectResolutionExhaustedException(String message, Throwable cause) {
    super(message, cause);
  }
}
