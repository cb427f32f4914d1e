package com.harness.alertmigration.ruleengine.translator;

public final class LegacyConditionIds {

  public static final String EVERY_EVENT =
      "sentry.rules.conditions.every_event.EveryEventCondition";
  public static final String FIRST_SEEN_EVENT =
      "sentry.rules.conditions.first_seen_event.FirstSeenEventCondition";
  public static final String REGRESSION_EVENT =
      "sentry.rules.conditions.regression_event.RegressionEventCondition";
  public static final String REAPPEARED_EVENT =
      "sentry.rules.conditions.reappeared_event.ReappearedEventCondition";
  public static final String EXISTING_HIGH_PRIORITY_ISSUE =
      "sentry.rules.conditions.high_priority_issue.ExistingHighPriorityIssueCondition";
  public static final String NEW_HIGH_PRIORITY_ISSUE =
      "sentry.rules.conditions.high_priority_issue.NewHighPriorityIssueCondition";
  public static final String EVENT_FREQUENCY =
      "sentry.rules.conditions.event_frequency.EventFrequencyCondition";
  public static final String EVENT_UNIQUE_USER_FREQUENCY =
      "sentry.rules.conditions.event_frequency.EventUniqueUserFrequencyCondition";
  public static final String EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS =
      "sentry.rules.conditions.event_frequency.EventUniqueUserFrequencyConditionWithConditions";
  public static final String EVENT_FREQUENCY_PERCENT =
      "sentry.rules.conditions.event_frequency.EventFrequencyPercentCondition";

  public static final String TAGGED_EVENT = "sentry.rules.filters.tagged_event.TaggedEventFilter";
  public static final String EVENT_ATTRIBUTE =
      "sentry.rules.filters.event_attribute.EventAttributeFilter";
  public static final String LEVEL = "sentry.rules.filters.level.LevelFilter";
  public static final String AGE_COMPARISON =
      "sentry.rules.filters.age_comparison.AgeComparisonFilter";
  public static final String ISSUE_OCCURRENCES =
      "sentry.rules.filters.issue_occurrences.IssueOccurrencesFilter";
  public static final String LATEST_RELEASE =
      "sentry.rules.filters.latest_release.LatestReleaseFilter";
  public static final String ASSIGNED_TO = "sentry.rules.filters.assigned_to.AssignedToFilter";
  public static final String ISSUE_CATEGORY =
      "sentry.rules.filters.issue_category.IssueCategoryFilter";

  private LegacyConditionIds() {}
}
