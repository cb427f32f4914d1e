package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.LogicType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

@Entity
@Table(name = "data_condition_groups")
public class DataConditionGroupEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @NotNull
  @Column(name = "organization_id", nullable = false)
  private Long organizationId;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "logic_type", nullable = false, length = 32)
  private LogicType logicType;

  public DataConditionGroupEntity() {}

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

  public LogicType getLogicType() {
    return logicType;
  }

  public void setLogicType(LogicType logicType) {
    this.logicType = logicType;
  }
}
