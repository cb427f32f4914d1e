package com.harness.alertmigration.enums;

public enum MigrationStatus {
  MIGRATED,
  VALIDATED,
  RETRYABLE_FAILURE,
  PERMANENT_FAILURE
}
