package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.enums.LogicType;
import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.enums.RuleSource;
import com.harness.alertmigration.enums.RuleStatus;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.exception.NoValidTriggerConditionsException;
import com.harness.alertmigration.exception.ValidationFailureException;
import com.harness.alertmigration.model.ActionDto;
import com.harness.alertmigration.model.ConditionGroupDto;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.WorkflowDto;
import com.harness.alertmigration.ruleengine.action.NotificationActionBuilder;
import com.harness.alertmigration.ruleengine.translator.ConditionRegistry;
import com.harness.alertmigration.ruleengine.translator.ConditionRegistry.SplitConditions;
import com.harness.alertmigration.ruleengine.translator.LegacyConditionIds;
import com.harness.alertmigration.service.RuleService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Migrates one legacy rule into a workflow: a "when" condition group built from the rule's
 * trigger conditions, an "if" condition group built from its filters, and the rule's actions
 * attached to the "if" group.
 *
 * <p>A dry run builds and validates the whole graph without writing, and fails on the first
 * invalid condition. A commit writes the graph in one transaction. Conditions that cannot be
 * translated are logged and skipped, and the rest of the graph is still written. The default
 * error detector is resolved before that transaction starts so its lock is held only briefly.
 */
@Service
public class RuleMigrationEngine {

  private static final Logger log = LoggerFactory.getLogger(RuleMigrationEngine.class);

  private final ConditionRegistry conditionRegistry;
  private final DefaultDetectorService detectorService;
  private final NotificationActionBuilder actionBuilder;
  private final RuleService ruleService;
  private final DryRunWorkflowWriter dryRunWriter;
  private final JpaWorkflowWriter commitWriter;
  private final TransactionTemplate transactionTemplate;
  private final int defaultFrequency;

  public RuleMigrationEngine(ConditionRegistry conditionRegistry,
                             DefaultDetectorService detectorService,
                             NotificationActionBuilder actionBuilder,
                             RuleService ruleService,
                             DryRunWorkflowWriter dryRunWriter,
                             JpaWorkflowWriter commitWriter,
                             PlatformTransactionManager transactionManager,
                             @Value("${migration.default-frequency-minutes:30}") int defaultFrequency) {
    this.conditionRegistry = conditionRegistry;
    this.detectorService = detectorService;
    this.actionBuilder = actionBuilder;
    this.ruleService = ruleService;
    this.dryRunWriter = dryRunWriter;
    this.commitWriter = commitWriter;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.defaultFrequency = defaultFrequency;
  }

  public WorkflowDto migrate(LegacyRule rule, MigrationMode mode, boolean createActions) {
    return migrate(rule, mode, createActions, null);
  }

  public WorkflowDto migrate(LegacyRule rule, MigrationMode mode, boolean createActions,
                             Long userId) {
    Objects.requireNonNull(rule, "rule");
    if (rule.id() == null) {
      throw new ValidationFailureException(null, "Rule must be saved before it can be migrated");
    }
    DetectorDto detector = resolveDetector(rule, mode);

    if (mode == MigrationMode.DRY_RUN) {
      // actions are not validated on a dry run
      return build(rule, dryRunWriter, detector, false, userId);
    }
    WorkflowDto workflow = transactionTemplate.execute(
        status -> build(rule, commitWriter, detector, createActions, userId));
    log.info("Migrated rule {} to workflow {} (enabled={}, triggers={}, filters={}, actions={})",
        rule.id(), workflow.id(), workflow.enabled(), workflow.whenGroup().conditions().size(),
        workflow.ifGroup().conditions().size(), workflow.actions().size());
    return workflow;
  }

  private DetectorDto resolveDetector(LegacyRule rule, MigrationMode mode) {
    if (rule.source() == RuleSource.CRON_MONITOR) {
      return null;
    }
    if (mode == MigrationMode.DRY_RUN) {
      return detectorService.findDefaultErrorDetector(rule.projectId())
          .orElseGet(() -> DetectorDto.placeholder(rule.projectId()));
    }
    return detectorService.ensureDefaultErrorDetector(rule.projectId());
  }

  private WorkflowDto build(LegacyRule rule, WorkflowWriter writer, DetectorDto detector,
                            boolean createActions, Long userId) {
    writer.linkDetector(rule, detector);
    SplitConditions split = conditionRegistry.split(rule.conditions());

    ConditionGroupDto whenGroup = writer.createConditionGroup(rule, whenLogicType(rule));
    List<DataConditionDto> triggers =
        writeConditions(rule, writer, whenGroup, split.conditions(), split.filters());
    checkTriggerConditions(rule, split.conditions(), triggers);
    whenGroup = whenGroup.withConditions(triggers);

    WorkflowDto workflow = writer.createWorkflow(rule, new WorkflowDto(
        null,
        rule.organizationId(),
        rule.label(),
        rule.environmentId(),
        Map.of("frequency", frequencyOf(rule)),
        isEnabled(rule),
        userId,
        rule.ownerUserId(),
        rule.ownerTeamId(),
        rule.dateAdded(),
        detector,
        whenGroup,
        null,
        List.of()
    ));

    // always created, since actions hang off the "if" group
    ConditionGroupDto ifGroup = writer.createConditionGroup(rule, ifLogicType(rule));
    writer.linkIfGroup(workflow, ifGroup);
    List<DataConditionDto> filters = absorbsFilters(split.conditions())
        ? List.of()
        : writeConditions(rule, writer, ifGroup, split.filters(), null);
    workflow = workflow.withIfGroup(ifGroup.withConditions(filters));

    if (createActions) {
      List<ActionDto> actions = writer.writeActions(workflow.ifGroup(),
          actionBuilder.build(rule.id(), rule.actions()));
      workflow = workflow.withActions(actions);
    }
    return workflow;
  }

  private List<DataConditionDto> writeConditions(LegacyRule rule, WorkflowWriter writer,
                                                 ConditionGroupDto group,
                                                 List<Map<String, Object>> specs,
                                                 List<Map<String, Object>> filters) {
    List<DataConditionDto> translated = new ArrayList<>();
    for (Map<String, Object> spec : specs) {
      try {
        translated.add(LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS.equals(idOf(spec))
            ? conditionRegistry.translateWithFilters(spec, filters)
            : conditionRegistry.translate(spec));
      } catch (ConditionTranslationException e) {
        if (writer.mode() == MigrationMode.DRY_RUN) {
          throw new ValidationFailureException(rule.id(),
              "Condition " + idOf(spec) + " could not be translated: " + e.getMessage(), e);
        }
        log.error("Skipping condition during migration: ruleId={}, condition={}, error={}",
            rule.id(), idOf(spec), e.getMessage());
      }
    }
    List<DataConditionDto> kept = translated.stream()
        .filter(condition -> condition.type() != ConditionType.EVERY_EVENT)
        .toList();
    return writer.writeConditions(rule, group, kept);
  }

  /**
   * An empty "when" group fires on every event. That is only acceptable when the rule had no
   * trigger conditions at all, or when every one of them was the every-event condition.
   */
  private void checkTriggerConditions(LegacyRule rule, List<Map<String, Object>> conditions,
                                      List<DataConditionDto> written) {
    if (conditions.isEmpty() || !written.isEmpty()) {
      return;
    }
    boolean onlyEveryEvent = conditions.stream()
        .allMatch(spec -> LegacyConditionIds.EVERY_EVENT.equals(idOf(spec)));
    if (!onlyEveryEvent) {
      throw new NoValidTriggerConditionsException(rule.id());
    }
  }

  // zero means "not set" in legacy rule data
  private int frequencyOf(LegacyRule rule) {
    Integer frequency = rule.frequency();
    return frequency != null && frequency > 0 ? frequency : defaultFrequency;
  }

  private boolean isEnabled(LegacyRule rule) {
    if (rule.status() == RuleStatus.DISABLED) {
      return false;
    }
    return !ruleService.isPermanentlySnoozed(rule.id());
  }

  private LogicType whenLogicType(LegacyRule rule) {
    String actionMatch = rule.actionMatchOrDefault();
    if ("any".equals(actionMatch)) {
      return LogicType.ANY_SHORT_CIRCUIT;
    }
    return parseLogicType(rule, actionMatch);
  }

  private LogicType ifLogicType(LegacyRule rule) {
    String filterMatch = rule.filterMatch();
    if (filterMatch == null || filterMatch.isBlank() || "any".equals(filterMatch)) {
      return LogicType.ANY_SHORT_CIRCUIT;
    }
    return parseLogicType(rule, filterMatch);
  }

  private LogicType parseLogicType(LegacyRule rule, String match) {
    try {
      return LogicType.fromValue(match);
    } catch (IllegalArgumentException e) {
      throw new ValidationFailureException(rule.id(), "Unsupported match type '" + match + "'", e);
    }
  }

  private boolean absorbsFilters(List<Map<String, Object>> conditions) {
    return conditions.stream().anyMatch(
        spec -> LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS.equals(idOf(spec)));
  }

  private static String idOf(Map<String, Object> spec) {
    Object id = spec.get("id");
    return id != null ? id.toString() : null;
  }
}
