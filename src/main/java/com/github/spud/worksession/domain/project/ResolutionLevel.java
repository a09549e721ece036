package com.github.spud.worksession.domain.project;

/**
 * Levels of the project resolution chain, in the order they are tried
 */
public enum ResolutionLevel {
  EXPLICIT("explicit"),
  CURRENT_PROJECT("current_project"),
  PRIMARY_PROJECT("primary_project"),
  SYSTEM_DEFAULT("system_default"),
  PERSONAL_PROJECT("personal_project");

  private final String label;

  ResolutionLevel(String label) {
    this.label = label;
  }

  /**
   * Value recorded in session metadata
   */
  public String label() {
    return label;
  }
}
