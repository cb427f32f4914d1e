package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.ConditionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

@Entity
@Table(name = "data_conditions")
public class DataConditionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 64)
  private ConditionType type;

  @NotNull
  @Lob
  @Column(name = "comparison_json", nullable = false)
  private String comparisonJson;

  @NotNull
  @Column(name = "condition_result_json", nullable = false, length = 256)
  private String conditionResultJson;

  @Column(name = "condition_group_id", nullable = false)
  private Long conditionGroupId;

  public DataConditionEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public ConditionType getType() {
    return type;
  }

  public void setType(ConditionType type) {
    this.type = type;
  }

  public String getComparisonJson() {
    return comparisonJson;
  }

  public void setComparisonJson(String comparisonJson) {
    this.comparisonJson = comparisonJson;
  }

  public String getConditionResultJson() {
    return conditionResultJson;
  }

  public void setConditionResultJson(String conditionResultJson) {
    this.conditionResultJson = conditionResultJson;
  }

  public Long getConditionGroupId() {
    return conditionGroupId;
  }

  public void setConditionGroupId(Long conditionGroupId) {
    this.conditionGroupId = conditionGroupId;
  }
}
