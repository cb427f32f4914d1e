package com.harness.alertmigration.exception;

public class AlreadyMigratedException extends MigrationException {

  public AlreadyMigratedException(Long ruleId) {
    super(ruleId, "Issue alert " + ruleId + " already migrated");
  }

  @Override
  public String code() {
    return "already_migrated";
  }
}
