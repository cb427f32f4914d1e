package com.harness.alertmigration.service;

import com.harness.alertmigration.enums.RuleSource;
import com.harness.alertmigration.enums.RuleStatus;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.ruleengine.translator.LegacyConditionIds;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class RuleServiceIntegrationTest {

  @Autowired
  private RuleService ruleService;

  @Test
  void createGetAndListRulesByProject() {
    long projectA = 30_001L;
    long projectB = 30_002L;

    LegacyRule first = ruleService.createRule(newRule(projectA, "High volume", RuleStatus.ACTIVE));
    LegacyRule second = ruleService.createRule(newRule(projectA, "Muted", RuleStatus.DISABLED));
    ruleService.createRule(newRule(projectB, "Other project", RuleStatus.ACTIVE));

    Optional<LegacyRule> loaded = ruleService.getRule(first.id());
    assertThat(loaded).isPresent();
    assertThat(loaded.get().label()).isEqualTo("High volume");
    assertThat(loaded.get().conditions())
        .singleElement()
        .satisfies(spec -> assertThat(spec)
            .containsEntry("id", LegacyConditionIds.EVENT_FREQUENCY)
            .containsEntry("interval", "1h")
            .containsEntry("value", 100));
    assertThat(loaded.get().actionMatch()).isEqualTo("any");
    assertThat(loaded.get().frequency()).isEqualTo(60);
    assertThat(loaded.get().source()).isEqualTo(RuleSource.ISSUE);
    assertThat(loaded.get().dateAdded()).isNotNull();

    assertThat(ruleService.listRulesForProject(projectA))
        .extracting(LegacyRule::id)
        .containsExactly(first.id(), second.id());
    assertThat(ruleService.listRulesForProject(projectB)).hasSize(1);
    assertThat(ruleService.getRule(Long.MAX_VALUE)).isEmpty();
  }

  @Test
  void onlyOrganizationWideOpenEndedSnoozeIsPermanent() {
    LegacyRule permanent = ruleService.createRule(newRule(30_003L, "Permanent", RuleStatus.ACTIVE));
    LegacyRule temporary = ruleService.createRule(newRule(30_003L, "Temporary", RuleStatus.ACTIVE));
    LegacyRule personal = ruleService.createRule(newRule(30_003L, "Personal", RuleStatus.ACTIVE));
    LegacyRule untouched = ruleService.createRule(newRule(30_003L, "Untouched", RuleStatus.ACTIVE));

    ruleService.snoozeRule(permanent.id(), null, null);
    ruleService.snoozeRule(temporary.id(), null, Instant.now().plus(2, ChronoUnit.HOURS));
    ruleService.snoozeRule(personal.id(), 7L, null);

    assertThat(ruleService.isPermanentlySnoozed(permanent.id())).isTrue();
    assertThat(ruleService.isPermanentlySnoozed(temporary.id())).isFalse();
    assertThat(ruleService.isPermanentlySnoozed(personal.id())).isFalse();
    assertThat(ruleService.isPermanentlySnoozed(untouched.id())).isFalse();
  }

  @Test
  void permanentSnoozeCountsEvenWhenAnEarlierSnoozeExpires() {
    LegacyRule rule = ruleService.createRule(newRule(30_004L, "Snoozed twice", RuleStatus.ACTIVE));

    ruleService.snoozeRule(rule.id(), null, Instant.now().plus(1, ChronoUnit.DAYS));
    assertThat(ruleService.isPermanentlySnoozed(rule.id())).isFalse();

    ruleService.snoozeRule(rule.id(), null, null);
    assertThat(ruleService.isPermanentlySnoozed(rule.id())).isTrue();
  }

  private LegacyRule newRule(long projectId, String label, RuleStatus status) {
    Map<String, Object> condition = Map.of(
        "id", LegacyConditionIds.EVENT_FREQUENCY,
        "interval", "1h",
        "value", 100);

    return new LegacyRule(
        null,
        projectId,
        1L,
        label,
        null,
        List.of(condition),
        List.of(),
        "any",
        null,
        60,
        status,
        null,
        null,
        null,
        null
    );
  }
}
