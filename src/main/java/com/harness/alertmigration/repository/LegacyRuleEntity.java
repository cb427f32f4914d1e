package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.RuleSource;
import com.harness.alertmigration.enums.RuleStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "legacy_rules")
public class LegacyRuleEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "organization_id", nullable = false)
  private Long organizationId;

  @Column(name = "label", nullable = false, length = 256)
  private String label;

  @Column(name = "environment_id")
  private Long environmentId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private RuleStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, length = 16)
  private RuleSource source;

  @Column(name = "owner_user_id")
  private Long ownerUserId;

  @Column(name = "owner_team_id")
  private Long ownerTeamId;

  @Lob
  @Column(name = "data_json", nullable = false)
  private String dataJson;

  @Column(name = "date_added", nullable = false, updatable = false)
  private Instant dateAdded;

  public LegacyRuleEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public void setProjectId(Long projectId) {
    this.projectId = projectId;
  }

  public Long getOrganizationId() {
    return organizationId;
  }

  public void setOrganizationId(Long organizationId) {
    this.organizationId = organizationId;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public Long getEnvironmentId() {
    return environmentId;
  }

  public void setEnvironmentId(Long environmentId) {
    this.environmentId = environmentId;
  }

  public RuleStatus getStatus() {
    return status;
  }

  public void setStatus(RuleStatus status) {
    this.status = status;
  }

  public RuleSource getSource() {
    return source;
  }

  public void setSource(RuleSource source) {
    this.source = source;
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

  public String getDataJson() {
    return dataJson;
  }

  public void setDataJson(String dataJson) {
    this.dataJson = dataJson;
  }

  public Instant getDateAdded() {
    return dateAdded;
  }

  public void setDateAdded(Instant dateAdded) {
    this.dateAdded = dateAdded;
  }
}
