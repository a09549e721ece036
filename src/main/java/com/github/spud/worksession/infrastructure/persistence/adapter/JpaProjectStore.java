package com.github.spud.worksession.infrastructure.persistence.adapter;

import com.github.spud.worksession.domain.project.CurrentProjectRegistry;
import com.github.spud.worksession.domain.project.ProjectStore;
import com.github.spud.worksession.domain.project.ProjectSummary;
import com.github.spud.worksession.infrastructure.persistence.entity.ProjectEntity;
import com.github.spud.worksession.infrastructure.persistence.repository.ProjectRepository;
import com.github.spud.worksession.infrastructure.util.JsonUtils;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaProjectStore implements ProjectStore {

  private final ProjectRepository repository;
  private final CurrentProjectRegistry currentProjects;

  @Override
  public Optional<ProjectSummary> getById(UUID projectId) {
    return repository.findById(projectId).map(this::toSummary);
  }

  @Override
  public Optional<ProjectSummary> getPrimary() {
    return repository.findPrimary().map(this::toSummary);
  }

  @Override
  public Optional<ProjectSummary> getCurrentForCaller(String callerKey) {
    return currentProjects.getCurrent(callerKey).flatMap(this::getById);
  }

  @Override
  public Optional<ProjectSummary> findByName(String name) {
    return repository.findByName(name).map(this::toSummary);
  }

  @Override
  public List<ProjectSummary> listAll() {
    return repository.findAllByOrderByCreatedAtAsc().stream()
      .map(this::toSummary)
      .collect(Collectors.toList());
  }

  @Override
  public ProjectSummary getOrCreateDefault(String name) {
    return upsert(name, "Default project for sessions started without one",
      Map.of("auto_created", true, "system_default", true));
  }

  @Override
  public ProjectSummary createPersonal(String name) {
    return upsert(name, "Personal project created when no other project was available",
      Map.of("auto_created", true, "personal", true));
  }

  private ProjectSummary upsert(String name, String description, Map<String, Object> metadata) {
    if (repository.insertIfAbsent(name, description, JsonUtils.toJson(metadata)) == 1) {
      log.info("Created project '{}'", name);
    }
    return repository.findByName(name)
      .map(this::toSummary)
      .orElseThrow(() -> new IllegalStateException("Project '" + name + "' missing after upsert"));
  }

  private ProjectSummary toSummary(ProjectEntity entity) {
    return new ProjectSummary(entity.getId(), entity.getName(), entity.isPrimary());
  }
}
