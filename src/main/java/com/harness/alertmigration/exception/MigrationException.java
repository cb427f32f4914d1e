package com.harness.alertmigration.exception;

public abstract class MigrationException extends RuntimeException {

  private final Long ruleId;

  protected MigrationException(Long ruleId, String message) {
    super(message);
    this.ruleId = ruleId;
  }

  protected MigrationException(Long ruleId, String message, Throwable cause) {
    super(message, cause);
    this.ruleId = ruleId;
  }

  public Long getRuleId() {
    return ruleId;
  }

  public abstract String code();

  public boolean isRetryable() {
    return false;
  }
}
