package com.harness.alertmigration.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "data_condition_group_actions")
public class DataConditionGroupActionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "condition_group_id", nullable = false)
  private Long conditionGroupId;

  @Column(name = "action_id", nullable = false)
  private Long actionId;

  public DataConditionGroupActionEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getConditionGroupId() {
    return conditionGroupId;
  }

  public void setConditionGroupId(Long conditionGroupId) {
    this.conditionGroupId = conditionGroupId;
  }

  public Long getActionId() {
    return actionId;
  }

  public void setActionId(Long actionId) {
    this.actionId = actionId;
  }
}
