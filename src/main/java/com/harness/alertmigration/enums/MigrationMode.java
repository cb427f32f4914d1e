package com.harness.alertmigration.enums;

public enum MigrationMode {
  DRY_RUN,
  COMMIT
}
