package com.harness.alertmigration.enums;

public enum RuleStatus {
  ACTIVE,
  DISABLED
}
