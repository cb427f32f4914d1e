package com.harness.alertmigration.exception;

public class ValidationFailureException extends MigrationException {

  public ValidationFailureException(Long ruleId, String message) {
    super(ruleId, message);
  }

  public ValidationFailureException(Long ruleId, String message, Throwable cause) {
    super(ruleId, message, cause);
  }

  @Override
  public String code() {
    return "validation_failure";
  }
}
