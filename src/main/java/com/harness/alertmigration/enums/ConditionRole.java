package com.harness.alertmigration.enums;

public enum ConditionRole {
  CONDITION,
  FILTER
}
