package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.ConditionType;

public record DataConditionDto(
    Long id,
    ConditionType type,
    Object comparison,
    Object conditionResult,
    Long conditionGroupId
) {

  public static DataConditionDto unsaved(ConditionType type, Object comparison) {
    return new DataConditionDto(null, type, comparison, Boolean.TRUE, null);
  }

  public DataConditionDto withSaved(Long id, Long conditionGroupId) {
    return new DataConditionDto(id, type, comparison, conditionResult, conditionGroupId);
  }
}
