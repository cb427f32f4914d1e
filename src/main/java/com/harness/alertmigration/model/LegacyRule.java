package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.RuleSource;
import com.harness.alertmigration.enums.RuleStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record LegacyRule(
    Long id,
    Long projectId,
    Long organizationId,
    String label,
    Long environmentId,
    List<Map<String, Object>> conditions,
    List<Map<String, Object>> actions,
    String actionMatch,
    String filterMatch,
    Integer frequency,
    RuleStatus status,
    RuleSource source,
    Long ownerUserId,
    Long ownerTeamId,
    Instant dateAdded
) {

  public static final String DEFAULT_ACTION_MATCH = "all";

  public LegacyRule {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    actions = actions == null ? List.of() : List.copyOf(actions);
    status = status == null ? RuleStatus.ACTIVE : status;
    source = source == null ? RuleSource.ISSUE : source;
  }

  public String actionMatchOrDefault() {
    return actionMatch == null || actionMatch.isBlank() ? DEFAULT_ACTION_MATCH : actionMatch;
  }
}
