package com.harness.alertmigration.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alertmigration.enums.LogicType;
import com.harness.alertmigration.model.ActionDto;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.model.WorkflowDto;
import com.harness.alertmigration.repository.ActionEntity;
import com.harness.alertmigration.repository.DataConditionEntity;
import com.harness.alertmigration.repository.DataConditionGroupEntity;
import com.harness.alertmigration.repository.WorkflowEntity;
import org.springframework.stereotype.Component;

@Component
public class WorkflowEntityMapper {

  private final ObjectMapper objectMapper;

  public WorkflowEntityMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public DataConditionGroupEntity toGroupEntity(Long organizationId, LogicType logicType) {
    DataConditionGroupEntity entity = new DataConditionGroupEntity();
    entity.setOrganizationId(organizationId);
    entity.setLogicType(logicType);
    return entity;
  }

  public DataConditionEntity toConditionEntity(DataConditionDto condition, Long conditionGroupId) {
    DataConditionEntity entity = new DataConditionEntity();
    entity.setType(condition.type());
    entity.setComparisonJson(serialize(condition.comparison(), "condition comparison"));
    entity.setConditionResultJson(serialize(condition.conditionResult(), "condition result"));
    entity.setConditionGroupId(conditionGroupId);
    return entity;
  }

  public WorkflowEntity toWorkflowEntity(WorkflowDto workflow) {
    WorkflowEntity entity = new WorkflowEntity();
    entity.setOrganizationId(workflow.organizationId());
    entity.setName(workflow.name());
    entity.setEnvironmentId(workflow.environmentId());
    entity.setWhenConditionGroupId(workflow.whenGroup() != null ? workflow.whenGroup().id() : null);
    entity.setCreatedById(workflow.createdById());
    entity.setOwnerUserId(workflow.ownerUserId());
    entity.setOwnerTeamId(workflow.ownerTeamId());
    entity.setConfigJson(serialize(workflow.config(), "workflow config"));
    entity.setEnabled(workflow.enabled());
    entity.setDateAdded(workflow.dateAdded());
    return entity;
  }

  public ActionEntity toActionEntity(ActionDto action) {
    ActionEntity entity = new ActionEntity();
    entity.setType(action.type());
    entity.setIntegrationId(action.integrationId());
    entity.setConfigJson(serialize(action.config(), "action config"));
    entity.setDataJson(serialize(action.data(), "action data"));
    return entity;
  }

  private String serialize(Object value, String what) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize " + what, e);
    }
  }
}
