package com.harness.alertmigration.enums;

public enum ConditionType {
  // trigger conditions
  EVERY_EVENT,
  FIRST_SEEN_EVENT,
  REGRESSION_EVENT,
  REAPPEARED_EVENT,
  EXISTING_HIGH_PRIORITY_ISSUE,
  NEW_HIGH_PRIORITY_ISSUE,
  EVENT_FREQUENCY_COUNT,
  EVENT_FREQUENCY_PERCENT,
  EVENT_UNIQUE_USER_FREQUENCY_COUNT,
  EVENT_UNIQUE_USER_FREQUENCY_PERCENT,
  PERCENT_SESSIONS_COUNT,
  PERCENT_SESSIONS_PERCENT,

  // filters
  TAGGED_EVENT,
  EVENT_ATTRIBUTE,
  LEVEL,
  AGE_COMPARISON,
  ISSUE_OCCURRENCES,
  LATEST_RELEASE,
  ASSIGNED_TO,
  ISSUE_CATEGORY;

  public boolean isFlag() {
    return switch (this) {
      case EVERY_EVENT, FIRST_SEEN_EVENT, REGRESSION_EVENT, REAPPEARED_EVENT,
           EXISTING_HIGH_PRIORITY_ISSUE, NEW_HIGH_PRIORITY_ISSUE, LATEST_RELEASE -> true;
      default -> false;
    };
  }
}
