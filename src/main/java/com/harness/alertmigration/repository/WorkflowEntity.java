package com.harness.alertmigration.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@Entity
@Table(name = "workflows")
public class WorkflowEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @NotNull
  @Column(name = "organization_id", nullable = false)
  private Long organizationId;

  @NotBlank
  @Size(max = 256)
  @Column(name = "name", nullable = false, length = 256)
  private String name;

  @Column(name = "environment_id")
  private Long environmentId;

  @Column(name = "when_condition_group_id")
  private Long whenConditionGroupId;

  @Column(name = "created_by_id")
  private Long createdById;

  @Column(name = "owner_user_id")
  private Long ownerUserId;

  @Column(name = "owner_team_id")
  private Long ownerTeamId;

  @NotNull
  @Lob
  @Column(name = "config_json", nullable = false)
  private String configJson;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "date_added", nullable = false)
  private Instant dateAdded;

  public WorkflowEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getOrganizationId() {
    return organizationId;
  }

  public void setOrganizationId(Long organizationId) {
    this.organizationId = organizationId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Long getEnvironmentId() {
    return environmentId;
  }

  public void setEnvironmentId(Long environmentId) {
    this.environmentId = environmentId;
  }

  public Long getWhenConditionGroupId() {
    return whenConditionGroupId;
  }

  public void setWhenConditionGroupId(Long whenConditionGroupId) {
    this.whenConditionGroupId = whenConditionGroupId;
  }

  public Long getCreatedById() {
    return createdById;
  }

  public void setCreatedById(Long createdById) {
    this.createdById = createdById;
  }

  public Long getOwnerUserId() {
    return ownerUserId;
  }

  public void setOwnerUserId(Long ownerUserId) {
    this.ownerUserId = ownerUserId;
  }

  public Long getOwnerTeamId() {
    return ownerTeamId;
  }

  public void setOwnerTeamId(Long ownerTeamId) {
    this.ownerTeamId = ownerTeamId;
  }

  public String getConfigJson() {
    return configJson;
  }

  public void setConfigJson(String configJson) {
    this.configJson = configJson;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Instant getDateAdded() {
    return dateAdded;
  }

  public void setDateAdded(Instant dateAdded) {
    this.dateAdded = dateAdded;
  }
}
