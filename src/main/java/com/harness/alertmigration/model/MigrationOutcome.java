package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.MigrationStatus;

public record MigrationOutcome(
    Long ruleId,
    MigrationStatus status,
    Long workflowId,
    String errorCode,
    String message
) {

  public static MigrationOutcome succeeded(Long ruleId, MigrationStatus status, WorkflowDto workflow) {
    return new MigrationOutcome(ruleId, status, workflow.id(), null, null);
  }

  public static MigrationOutcome failed(Long ruleId, MigrationStatus status, String code, String message) {
    return new MigrationOutcome(ruleId, status, null, code, message);
  }

  public boolean isFailure() {
    return status == MigrationStatus.RETRYABLE_FAILURE || status == MigrationStatus.PERMANENT_FAILURE;
  }
}
