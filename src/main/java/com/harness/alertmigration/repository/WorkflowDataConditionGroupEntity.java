package com.harness.alertmigration.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "workflow_data_condition_groups")
public class WorkflowDataConditionGroupEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "workflow_id", nullable = false)
  private Long workflowId;

  @Column(name = "condition_group_id", nullable = false)
  private Long conditionGroupId;

  public WorkflowDataConditionGroupEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getWorkflowId() {
    return workflowId;
  }

  public void setWorkflowId(Long workflowId) {
    this.workflowId = workflowId;
  }

  public Long getConditionGroupId() {
    return conditionGroupId;
  }

  public void setConditionGroupId(Long conditionGroupId) {
    this.conditionGroupId = conditionGroupId;
  }
}
