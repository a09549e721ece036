package com.github.spud.worksession.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Project registry row. Rows are created through the upsert in the repository, so the id is
 * always assigned by the database.
 */
@Getter
@Setter
@Entity
@Table(name = "projects")
public class ProjectEntity {

  @Id
  @ColumnDefault("gen_random_uuid()")
  @Column(name = "id", nullable = false)
  private UUID id;

  @Size(max = 255)
  @NotNull
  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "description", length = Integer.MAX_VALUE)
  private String description;

  @Size(max = 20)
  @ColumnDefault("'active'")
  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", nullable = false)
  private Map<String, Object> metadata;

  @ColumnDefault("now()")
  @Column(name = "created_at", insertable = false, updatable = false)
  private OffsetDateTime createdAt;

  @ColumnDefault("now()")
  @Column(name = "updated_at", insertable = false, updatable = false)
  private OffsetDateTime updatedAt;

  /**
   * Whether the project carries the primary designation in its metadata
   */
  public boolean isPrimary() {
    if (metadata == null) {
      return false;
    }
    Object flag = metadata.get("is_primary");
    return Boolean.TRUE.equals(flag) || "true".equals(String.valueOf(flag));
  }
}
