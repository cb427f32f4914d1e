package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.LogicType;
import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.model.ActionDto;
import com.harness.alertmigration.model.ConditionGroupDto;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.WorkflowDto;
import java.util.List;

/**
 * Receives every artifact the migration builds, in build order. Implementations either validate
 * only ({@link MigrationMode#DRY_RUN}) or persist ({@link MigrationMode#COMMIT}).
 */
public interface WorkflowWriter {

  MigrationMode mode();

  void linkDetector(LegacyRule rule, DetectorDto detector);

  ConditionGroupDto createConditionGroup(LegacyRule rule, LogicType logicType);

  /**
   * Writes the translated conditions into {@code group} and returns the ones that were accepted.
   */
  List<DataConditionDto> writeConditions(LegacyRule rule, ConditionGroupDto group,
                                         List<DataConditionDto> conditions);

  WorkflowDto createWorkflow(LegacyRule rule, WorkflowDto draft);

  void linkIfGroup(WorkflowDto workflow, ConditionGroupDto ifGroup);

  List<ActionDto> writeActions(ConditionGroupDto ifGroup, List<ActionDto> actions);
}
