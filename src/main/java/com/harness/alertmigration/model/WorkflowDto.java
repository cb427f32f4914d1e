package com.harness.alertmigration.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record WorkflowDto(
    Long id,
    Long organizationId,
    String name,
    Long environmentId,
    Map<String, Object> config,
    boolean enabled,
    Long createdById,
    Long ownerUserId,
    Long ownerTeamId,
    Instant dateAdded,
    DetectorDto detector,
    ConditionGroupDto whenGroup,
    ConditionGroupDto ifGroup,
    List<ActionDto> actions
) {

  public WorkflowDto {
    config = config == null ? Map.of() : Map.copyOf(config);
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  public WorkflowDto withIfGroup(ConditionGroupDto group) {
    return new WorkflowDto(id, organizationId, name, environmentId, config, enabled, createdById,
        ownerUserId, ownerTeamId, dateAdded, detector, whenGroup, group, actions);
  }

  public WorkflowDto withActions(List<ActionDto> newActions) {
    return new WorkflowDto(id, organizationId, name, environmentId, config, enabled, createdById,
        ownerUserId, ownerTeamId, dateAdded, detector, whenGroup, ifGroup, newActions);
  }
}
