package com.harness.alertmigration.exception;

public class RuleNotFoundException extends MigrationException {

  public RuleNotFoundException(Long ruleId) {
    super(ruleId, "Legacy rule " + ruleId + " not found");
  }

  @Override
  public String code() {
    return "rule_not_found";
  }
}
