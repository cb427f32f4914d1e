package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionRole;
import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import com.harness.alertmigration.ruleengine.translator.ConditionRegistry.SplitConditions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionRegistryTest {

  private ConditionRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ConditionRegistry();
  }

  @Test
  void splitSeparatesConditionsFromFiltersAndKeepsOrder() {
    Map<String, Object> firstSeen = Map.of("id", LegacyConditionIds.FIRST_SEEN_EVENT);
    Map<String, Object> level = Map.of("id", LegacyConditionIds.LEVEL, "level", "40", "match", "gte");
    Map<String, Object> regression = Map.of("id", LegacyConditionIds.REGRESSION_EVENT);
    Map<String, Object> tagged = Map.of(
        "id", LegacyConditionIds.TAGGED_EVENT, "key", "env", "match", "eq", "value", "prod");

    SplitConditions split = registry.split(List.of(firstSeen, level, regression, tagged));

    assertThat(split.conditions()).containsExactly(firstSeen, regression);
    assertThat(split.filters()).containsExactly(level, tagged);
  }

  @Test
  void unknownDiscriminatorIsTreatedAsConditionAndFailsTranslation() {
    Map<String, Object> unknown = Map.of("id", "unknown_kind");

    SplitConditions split = registry.split(List.of(unknown));

    assertThat(split.conditions()).containsExactly(unknown);
    assertThat(split.filters()).isEmpty();
    assertThatThrownBy(() -> registry.translate(unknown))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("Unsupported condition: unknown_kind");
  }

  @Test
  void everyEventTranslatesToCatchAllType() {
    DataConditionDto condition =
        registry.translate(Map.of("id", LegacyConditionIds.EVERY_EVENT));

    assertThat(condition.type()).isEqualTo(ConditionType.EVERY_EVENT);
    assertThat(condition.comparison()).isEqualTo(Boolean.TRUE);
    assertThat(condition.conditionResult()).isEqualTo(Boolean.TRUE);
  }

  @Test
  void frequencyConditionPicksCountOrPercentFlavour() {
    DataConditionDto count = registry.translate(Map.of(
        "id", LegacyConditionIds.EVENT_FREQUENCY,
        "interval", "1h",
        "value", "100",
        "comparisonType", "count"));
    DataConditionDto percent = registry.translate(Map.of(
        "id", LegacyConditionIds.EVENT_FREQUENCY,
        "interval", "1h",
        "value", 50,
        "comparisonType", "percent",
        "comparisonInterval", "1w"));

    assertThat(count.type()).isEqualTo(ConditionType.EVENT_FREQUENCY_COUNT);
    assertThat(count.comparison()).isEqualTo(Map.of("interval", "1h", "value", 100));
    assertThat(percent.type()).isEqualTo(ConditionType.EVENT_FREQUENCY_PERCENT);
    assertThat(percent.comparison())
        .isEqualTo(Map.of("interval", "1h", "value", 50, "comparison_interval", "1w"));
  }

  @Test
  void frequencyConditionWithoutValueFails() {
    assertThatThrownBy(() -> registry.translate(Map.of(
        "id", LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY,
        "interval", "1h")))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("value");
  }

  @Test
  void taggedEventFilterOmitsValueForIsSetMatch() {
    DataConditionDto isSet = registry.translate(Map.of(
        "id", LegacyConditionIds.TAGGED_EVENT, "key", "customer", "match", "is"));

    assertThat(isSet.type()).isEqualTo(ConditionType.TAGGED_EVENT);
    assertThat(isSet.comparison()).isEqualTo(Map.of("key", "customer", "match", "is"));
  }

  @Test
  void issueFiltersCoerceNumericStrings() {
    DataConditionDto level = registry.translate(Map.of(
        "id", LegacyConditionIds.LEVEL, "level", "40", "match", "gte"));
    DataConditionDto occurrences = registry.translate(Map.of(
        "id", LegacyConditionIds.ISSUE_OCCURRENCES, "value", "10"));

    assertThat(level.comparison()).isEqualTo(Map.of("level", 40, "match", "gte"));
    assertThat(occurrences.comparison()).isEqualTo(Map.of("value", 10));
  }

  @Test
  void uniqueUserConditionAbsorbsTagAndAttributeFilters() {
    Map<String, Object> condition = Map.of(
        "id", LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS,
        "interval", "1d",
        "value", 25);
    List<Map<String, Object>> filters = List.of(
        Map.of("id", LegacyConditionIds.TAGGED_EVENT, "key", "env", "match", "eq", "value", "prod"),
        Map.of("id", LegacyConditionIds.EVENT_ATTRIBUTE, "attribute", "platform", "match", "ne",
            "value", "python"));

    DataConditionDto translated = registry.translateWithFilters(condition, filters);

    assertThat(translated.type()).isEqualTo(ConditionType.EVENT_UNIQUE_USER_FREQUENCY_COUNT);
    assertThat(translated.comparison()).isEqualTo(Map.of(
        "interval", "1d",
        "value", 25,
        "filters", List.of(
            Map.of("key", "env", "match", "eq", "value", "prod"),
            Map.of("attribute", "platform", "match", "ne", "value", "python"))));
  }

  @Test
  void uniqueUserConditionRejectsFiltersItCannotAbsorb() {
    Map<String, Object> condition = Map.of(
        "id", LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS,
        "interval", "1d",
        "value", 25);

    assertThatThrownBy(() -> registry.translateWithFilters(condition, List.of(
        Map.of("id", LegacyConditionIds.LATEST_RELEASE))))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("cannot be combined");
  }

  @Test
  void customTranslatorsCanBeRegistered() {
    registry.register("custom.Condition", ConditionRole.FILTER,
        spec -> DataConditionDto.unsaved(ConditionType.ISSUE_CATEGORY, Map.of("value", 3)));

    SplitConditions split = registry.split(List.of(Map.of("id", "custom.Condition")));

    assertThat(split.filters()).hasSize(1);
    assertThat(registry.translate(Map.of("id", "custom.Condition")).type())
        .isEqualTo(ConditionType.ISSUE_CATEGORY);
  }
}
