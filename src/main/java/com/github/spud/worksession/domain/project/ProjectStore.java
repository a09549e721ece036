package com.github.spud.worksession.domain.project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and create-if-absent access to the project registry. The registry itself is owned
 * elsewhere; the tracker only needs enough of it to guarantee a valid project reference.
 */
public interface ProjectStore {

  Optional<ProjectSummary> getById(UUID projectId);

  /**
   * Most recently created project flagged as primary. Always re-read, never cached.
   */
  Optional<ProjectSummary> getPrimary();

  /**
   * Ambient "current project" of a caller, when one is set and still exists
   */
  Optional<ProjectSummary> getCurrentForCaller(String callerKey);

  Optional<ProjectSummary> findByName(String name);

  List<ProjectSummary> listAll();

  /**
   * Return the project with this name, creating it if absent. Must be an atomic upsert so that
   * concurrent callers end up with the same project.
   */
  ProjectSummary getOrCreateDefault(String name);

  /**
   * Last-resort project, tagged as auto-created. Created at most once per name.
   */
  ProjectSummary createPersonal(String name);
}
