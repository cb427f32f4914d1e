package com.harness.alertmigration.enums;

public enum ActionType {
  EMAIL,
  SLACK,
  MSTEAMS,
  DISCORD,
  PAGERDUTY,
  OPSGENIE,
  WEBHOOK,
  PLUGIN
}
