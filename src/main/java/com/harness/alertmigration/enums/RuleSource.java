package com.harness.alertmigration.enums;

public enum RuleSource {
  ISSUE,
  CRON_MONITOR
}
