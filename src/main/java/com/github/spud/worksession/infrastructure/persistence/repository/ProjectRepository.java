package com.github.spud.worksession.infrastructure.persistence.repository;

import com.github.spud.worksession.infrastructure.persistence.entity.ProjectEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.NativeQuery;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ProjectRepository extends JpaRepository<ProjectEntity, UUID> {

  Optional<ProjectEntity> findByName(String name);

  List<ProjectEntity> findAllByOrderByCreatedAtAsc();

  @NativeQuery("""
    SELECT * FROM projects
    WHERE metadata ->> 'is_primary' = 'true'
    ORDER BY created_at DESC
    LIMIT 1
    """)
  Optional<ProjectEntity> findPrimary();

  /**
   * Atomic create-if-absent keyed on the unique project name
   *
   * @return 1 when this call created the row, 0 when it already existed
   */
  @Transactional
  @Modifying
  @NativeQuery("""
    INSERT INTO projects (name, description, metadata)
    VALUES (:name, :description, CAST(:metadata AS jsonb))
    ON CONFLICT (name) DO NOTHING
    """)
  int insertIfAbsent(@Param("name") String name, @Param("description") String description,
    @Param("metadata") String metadata);
}
