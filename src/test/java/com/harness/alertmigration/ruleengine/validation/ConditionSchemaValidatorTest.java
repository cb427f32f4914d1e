package com.harness.alertmigration.ruleengine.validation;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionSchemaValidatorTest {

  private final ConditionSchemaValidator validator = new ConditionSchemaValidator();

  @Test
  void acceptsWellFormedConditions() {
    assertThatCode(() -> {
      validator.validate(DataConditionDto.unsaved(ConditionType.FIRST_SEEN_EVENT, true));
      validator.validate(DataConditionDto.unsaved(ConditionType.EVENT_FREQUENCY_COUNT,
          Map.of("interval", "1h", "value", 10)));
      validator.validate(DataConditionDto.unsaved(ConditionType.EVENT_FREQUENCY_PERCENT,
          Map.of("interval", "1h", "value", 10, "comparison_interval", "1d")));
      validator.validate(DataConditionDto.unsaved(ConditionType.EVENT_UNIQUE_USER_FREQUENCY_COUNT,
          Map.of("interval", "1h", "value", 10,
              "filters", List.of(Map.of("key", "env", "match", "eq", "value", "prod")))));
      validator.validate(DataConditionDto.unsaved(ConditionType.LEVEL,
          Map.of("level", 40, "match", "gte")));
      validator.validate(DataConditionDto.unsaved(ConditionType.AGE_COMPARISON,
          Map.of("comparison_type", "older", "value", 3, "time", "week")));
      validator.validate(DataConditionDto.unsaved(ConditionType.ASSIGNED_TO,
          Map.of("target_type", "Unassigned")));
    }).doesNotThrowAnyException();
  }

  @Test
  void rejectsUnknownInterval() {
    assertThatThrownBy(() -> validator.validate(DataConditionDto.unsaved(
        ConditionType.EVENT_FREQUENCY_COUNT, Map.of("interval", "2h", "value", 10))))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("interval");
  }

  @Test
  void rejectsUnexpectedProperties() {
    assertThatThrownBy(() -> validator.validate(DataConditionDto.unsaved(
        ConditionType.ISSUE_OCCURRENCES, Map.of("value", 3, "extra", true))))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("unexpected property 'extra'");
  }

  @Test
  void rejectsUnknownLevel() {
    assertThatThrownBy(() -> validator.validate(DataConditionDto.unsaved(
        ConditionType.LEVEL, Map.of("level", 45, "match", "eq"))))
        .isInstanceOf(ConditionTranslationException.class);
  }

  @Test
  void rejectsMatchWithoutValue() {
    assertThatThrownBy(() -> validator.validate(DataConditionDto.unsaved(
        ConditionType.TAGGED_EVENT, Map.of("key", "env", "match", "eq"))))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("value is required");
  }

  @Test
  void rejectsAssigneeWithoutIdentifier() {
    assertThatThrownBy(() -> validator.validate(DataConditionDto.unsaved(
        ConditionType.ASSIGNED_TO, Map.of("target_type", "Team"))))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("target_identifier");
  }

  @Test
  void flagConditionsMustCompareToTrue() {
    assertThatThrownBy(() -> validator.validate(
        DataConditionDto.unsaved(ConditionType.REGRESSION_EVENT, Map.of())))
        .isInstanceOf(ConditionTranslationException.class);
  }

  @Test
  void workflowFrequencyMustBeWithinRange() {
    assertThatCode(() -> validator.validateWorkflowConfig(Map.of("frequency", 30)))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validateWorkflowConfig(Map.of("frequency", -5)))
        .isInstanceOf(ConditionTranslationException.class);
    assertThatThrownBy(() -> validator.validateWorkflowConfig(Map.of("frequency", 50_000)))
        .isInstanceOf(ConditionTranslationException.class);
  }
}
