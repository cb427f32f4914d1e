package com.harness.alertmigration.exception;

public class NoValidTriggerConditionsException extends MigrationException {

  public NoValidTriggerConditionsException(Long ruleId) {
    super(ruleId, "No valid trigger conditions, skipping migration of rule " + ruleId);
  }

  @Override
  public String code() {
    return "no_valid_trigger_conditions";
  }
}
