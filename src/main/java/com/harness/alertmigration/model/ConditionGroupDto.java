package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.LogicType;
import java.util.List;

public record ConditionGroupDto(
    Long id,
    Long organizationId,
    LogicType logicType,
    List<DataConditionDto> conditions
) {

  public ConditionGroupDto {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public ConditionGroupDto withConditions(List<DataConditionDto> newConditions) {
    return new ConditionGroupDto(id, organizationId, logicType, newConditions);
  }
}
