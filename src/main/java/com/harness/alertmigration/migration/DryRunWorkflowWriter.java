package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.LogicType;
import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.exception.AlreadyMigratedException;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.exception.ValidationFailureException;
import com.harness.alertmigration.model.ActionDto;
import com.harness.alertmigration.model.ConditionGroupDto;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.WorkflowDto;
import com.harness.alertmigration.repository.AlertRuleWorkflowRepository;
import com.harness.alertmigration.ruleengine.validation.ConditionSchemaValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class DryRunWorkflowWriter implements WorkflowWriter {

  private final Validator validator;
  private final ConditionSchemaValidator schemaValidator;
  private final WorkflowEntityMapper mapper;
  private final AlertRuleWorkflowRepository alertRuleWorkflowRepository;

  public DryRunWorkflowWriter(Validator validator,
                              ConditionSchemaValidator schemaValidator,
                              WorkflowEntityMapper mapper,
                              AlertRuleWorkflowRepository alertRuleWorkflowRepository) {
    this.validator = validator;
    this.schemaValidator = schemaValidator;
    this.mapper = mapper;
    this.alertRuleWorkflowRepository = alertRuleWorkflowRepository;
  }

  @Override
  public MigrationMode mode() {
    return MigrationMode.DRY_RUN;
  }

  @Override
  public void linkDetector(LegacyRule rule, DetectorDto detector) {
    // nothing to link until the rule is committed
  }

  @Override
  public ConditionGroupDto createConditionGroup(LegacyRule rule, LogicType logicType) {
    check(rule, validator.validate(mapper.toGroupEntity(rule.organizationId(), logicType)),
        "condition group");
    return new ConditionGroupDto(null, rule.organizationId(), logicType, List.of());
  }

  @Override
  public List<DataConditionDto> writeConditions(LegacyRule rule, ConditionGroupDto group,
                                                List<DataConditionDto> conditions) {
    for (DataConditionDto condition : conditions) {
      try {
        schemaValidator.validate(condition);
      } catch (ConditionTranslationException e) {
        throw new ValidationFailureException(rule.id(),
            "Condition " + condition.type() + " is invalid: " + e.getMessage(), e);
      }
      // the group has no id yet, which the entity constraints allow
      check(rule, validator.validate(mapper.toConditionEntity(condition, null)),
          "condition " + condition.type());
    }
    return conditions;
  }

  @Override
  public WorkflowDto createWorkflow(LegacyRule rule, WorkflowDto draft) {
    check(rule, validator.validate(mapper.toWorkflowEntity(draft)), "workflow");
    try {
      schemaValidator.validateWorkflowConfig(draft.config());
    } catch (ConditionTranslationException e) {
      throw new ValidationFailureException(rule.id(), e.getMessage(), e);
    }
    if (alertRuleWorkflowRepository.existsByRuleId(rule.id())) {
      throw new AlreadyMigratedException(rule.id());
    }
    return draft;
  }

  @Override
  public void linkIfGroup(WorkflowDto workflow, ConditionGroupDto ifGroup) {
    // links are only written on commit
  }

  @Override
  public List<ActionDto> writeActions(ConditionGroupDto ifGroup, List<ActionDto> actions) {
    return actions;
  }

  private <T> void check(LegacyRule rule, Set<ConstraintViolation<T>> violations, String subject) {
    if (!violations.isEmpty()) {
      String details = violations.stream()
          .map(v -> v.getPropertyPath() + " " + v.getMessage())
          .sorted()
          .collect(Collectors.joining(", "));
      throw new ValidationFailureException(rule.id(), "Invalid " + subject + ": " + details);
    }
  }
}
