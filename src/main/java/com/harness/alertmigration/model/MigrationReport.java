package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.enums.MigrationStatus;
import java.util.List;

public record MigrationReport(
    MigrationMode mode,
    List<MigrationOutcome> outcomes
) {

  public MigrationReport {
    outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
  }

  public long count(MigrationStatus status) {
    return outcomes.stream().filter(o -> o.status() == status).count();
  }

  public List<Long> retryableRuleIds() {
    return outcomes.stream()
        .filter(o -> o.status() == MigrationStatus.RETRYABLE_FAILURE)
        .map(MigrationOutcome::ruleId)
        .toList();
  }
}
