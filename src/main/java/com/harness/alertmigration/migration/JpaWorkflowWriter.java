package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.LogicType;
import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.exception.ValidationFailureException;
import com.harness.alertmigration.model.ActionDto;
import com.harness.alertmigration.model.ConditionGroupDto;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.WorkflowDto;
import com.harness.alertmigration.repository.ActionEntity;
import com.harness.alertmigration.repository.ActionRepository;
import com.harness.alertmigration.repository.AlertRuleDetectorEntity;
import com.harness.alertmigration.repository.AlertRuleDetectorRepository;
import com.harness.alertmigration.repository.AlertRuleWorkflowEntity;
import com.harness.alertmigration.repository.AlertRuleWorkflowRepository;
import com.harness.alertmigration.repository.DataConditionEntity;
import com.harness.alertmigration.repository.DataConditionGroupActionEntity;
import com.harness.alertmigration.repository.DataConditionGroupActionRepository;
import com.harness.alertmigration.repository.DataConditionGroupEntity;
import com.harness.alertmigration.repository.DataConditionGroupRepository;
import com.harness.alertmigration.repository.DataConditionRepository;
import com.harness.alertmigration.repository.DetectorWorkflowEntity;
import com.harness.alertmigration.repository.DetectorWorkflowRepository;
import com.harness.alertmigration.repository.WorkflowDataConditionGroupEntity;
import com.harness.alertmigration.repository.WorkflowDataConditionGroupRepository;
import com.harness.alertmigration.repository.WorkflowEntity;
import com.harness.alertmigration.repository.WorkflowRepository;
import com.harness.alertmigration.ruleengine.validation.ConditionSchemaValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists the workflow graph. Must run inside the caller's transaction.
 *
 * <p>Conditions are validated one at a time before insert; an invalid one is logged and skipped
 * while the rest are written. Conditions are never inserted unvalidated, since a failed insert
 * would mark the surrounding transaction rollback-only.
 */
@Component
public class JpaWorkflowWriter implements WorkflowWriter {

  private static final Logger log = LoggerFactory.getLogger(JpaWorkflowWriter.class);

  private final WorkflowEntityMapper mapper;
  private final Validator validator;
  private final ConditionSchemaValidator schemaValidator;
  private final AlertRuleDetectorRepository alertRuleDetectorRepository;
  private final DataConditionGroupRepository groupRepository;
  private final DataConditionRepository conditionRepository;
  private final WorkflowRepository workflowRepository;
  private final DetectorWorkflowRepository detectorWorkflowRepository;
  private final AlertRuleWorkflowRepository alertRuleWorkflowRepository;
  private final WorkflowDataConditionGroupRepository workflowGroupRepository;
  private final ActionRepository actionRepository;
  private final DataConditionGroupActionRepository groupActionRepository;

  public JpaWorkflowWriter(WorkflowEntityMapper mapper,
                           Validator validator,
                           ConditionSchemaValidator schemaValidator,
                           AlertRuleDetectorRepository alertRuleDetectorRepository,
                           DataConditionGroupRepository groupRepository,
                           DataConditionRepository conditionRepository,
                           WorkflowRepository workflowRepository,
                           DetectorWorkflowRepository detectorWorkflowRepository,
                           AlertRuleWorkflowRepository alertRuleWorkflowRepository,
                           WorkflowDataConditionGroupRepository workflowGroupRepository,
                           ActionRepository actionRepository,
                           DataConditionGroupActionRepository groupActionRepository) {
    this.mapper = mapper;
    this.validator = validator;
    this.schemaValidator = schemaValidator;
    this.alertRuleDetectorRepository = alertRuleDetectorRepository;
    this.groupRepository = groupRepository;
    this.conditionRepository = conditionRepository;
    this.workflowRepository = workflowRepository;
    this.detectorWorkflowRepository = detectorWorkflowRepository;
    this.alertRuleWorkflowRepository = alertRuleWorkflowRepository;
    this.workflowGroupRepository = workflowGroupRepository;
    this.actionRepository = actionRepository;
    this.groupActionRepository = groupActionRepository;
  }

  @Override
  public MigrationMode mode() {
    return MigrationMode.COMMIT;
  }

  @Override
  public void linkDetector(LegacyRule rule, DetectorDto detector) {
    if (detector == null || detector.isTransient()) {
      return;
    }
    alertRuleDetectorRepository.findByRuleIdAndDetectorId(rule.id(), detector.id())
        .orElseGet(() -> {
          AlertRuleDetectorEntity link = new AlertRuleDetectorEntity();
          link.setRuleId(rule.id());
          link.setDetectorId(detector.id());
          return alertRuleDetectorRepository.save(link);
        });
  }

  @Override
  public ConditionGroupDto createConditionGroup(LegacyRule rule, LogicType logicType) {
    DataConditionGroupEntity saved =
        groupRepository.save(mapper.toGroupEntity(rule.organizationId(), logicType));
    return new ConditionGroupDto(saved.getId(), saved.getOrganizationId(), saved.getLogicType(),
        List.of());
  }

  @Override
  public List<DataConditionDto> writeConditions(LegacyRule rule, ConditionGroupDto group,
                                                List<DataConditionDto> conditions) {
    List<DataConditionDto> written = new ArrayList<>();
    for (DataConditionDto condition : conditions) {
      try {
        schemaValidator.validate(condition);
      } catch (ConditionTranslationException e) {
        log.error("Skipping invalid condition during migration: ruleId={}, type={}, error={}",
            rule.id(), condition.type(), e.getMessage());
        continue;
      }
      DataConditionEntity saved =
          conditionRepository.save(mapper.toConditionEntity(condition, group.id()));
      written.add(condition.withSaved(saved.getId(), group.id()));
    }
    return written;
  }

  @Override
  public WorkflowDto createWorkflow(LegacyRule rule, WorkflowDto draft) {
    try {
      schemaValidator.validateWorkflowConfig(draft.config());
    } catch (ConditionTranslationException e) {
      throw new ValidationFailureException(rule.id(), e.getMessage(), e);
    }
    WorkflowEntity entity = mapper.toWorkflowEntity(draft);
    if (entity.getDateAdded() == null) {
      entity.setDateAdded(Instant.now());
    }
    Set<ConstraintViolation<WorkflowEntity>> violations = validator.validate(entity);
    if (!violations.isEmpty()) {
      throw new ValidationFailureException(rule.id(), "Invalid workflow: " + violations.stream()
          .map(v -> v.getPropertyPath() + " " + v.getMessage())
          .sorted()
          .collect(Collectors.joining(", ")));
    }
    WorkflowEntity saved = workflowRepository.save(entity);

    if (draft.detector() != null && !draft.detector().isTransient()) {
      DetectorWorkflowEntity detectorLink = new DetectorWorkflowEntity();
      detectorLink.setDetectorId(draft.detector().id());
      detectorLink.setWorkflowId(saved.getId());
      detectorWorkflowRepository.save(detectorLink);
    }

    AlertRuleWorkflowEntity marker = new AlertRuleWorkflowEntity();
    marker.setRuleId(rule.id());
    marker.setWorkflowId(saved.getId());
    alertRuleWorkflowRepository.save(marker);

    return new WorkflowDto(saved.getId(), draft.organizationId(), draft.name(),
        draft.environmentId(), draft.config(), draft.enabled(), draft.createdById(),
        draft.ownerUserId(), draft.ownerTeamId(), saved.getDateAdded(), draft.detector(),
        draft.whenGroup(), draft.ifGroup(), draft.actions());
  }

  @Override
  public void linkIfGroup(WorkflowDto workflow, ConditionGroupDto ifGroup) {
    WorkflowDataConditionGroupEntity link = new WorkflowDataConditionGroupEntity();
    link.setWorkflowId(workflow.id());
    link.setConditionGroupId(ifGroup.id());
    workflowGroupRepository.save(link);
  }

  @Override
  public List<ActionDto> writeActions(ConditionGroupDto ifGroup, List<ActionDto> actions) {
    List<ActionEntity> saved = actionRepository.saveAll(
        actions.stream().map(mapper::toActionEntity).toList());

    List<DataConditionGroupActionEntity> links = new ArrayList<>(saved.size());
    List<ActionDto> written = new ArrayList<>(saved.size());
    for (int i = 0; i < saved.size(); i++) {
      DataConditionGroupActionEntity link = new DataConditionGroupActionEntity();
      link.setConditionGroupId(ifGroup.id());
      link.setActionId(saved.get(i).getId());
      links.add(link);
      written.add(actions.get(i).withId(saved.get(i).getId()));
    }
    groupActionRepository.saveAll(links);
    return written;
  }
}
