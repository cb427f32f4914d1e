package com.harness.alertmigration.ruleengine.validation;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.enums.MatchType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks the comparison payload of a data condition against the shape its type requires, and
 * the workflow config against its schema. Unknown keys are rejected.
 */
@Component
public class ConditionSchemaValidator {

  static final Set<String> INTERVALS =
      Set.of("1m", "5m", "10m", "15m", "30m", "1h", "1d", "1w", "30d");
  static final Set<String> COMPARISON_INTERVALS = Set.of("5m", "15m", "1h", "1d", "1w", "30d");
  static final Set<Integer> LEVELS = Set.of(0, 10, 20, 30, 40, 50);
  static final Set<String> LEVEL_MATCHES = Set.of("eq", "gte", "lte");
  static final Set<String> AGE_COMPARISON_TYPES = Set.of("older", "newer");
  static final Set<String> AGE_UNITS = Set.of("minute", "hour", "day", "week");
  static final Set<String> ASSIGNEE_TYPES = Set.of("Unassigned", "Team", "Member");
  static final int MAX_FREQUENCY_MINUTES = 43_200;

  public void validate(DataConditionDto condition) {
    ConditionType type = condition.type();
    if (type == null) {
      throw invalid("unknown", "condition type is required");
    }
    Object comparison = condition.comparison();
    if (type.isFlag()) {
      if (!Boolean.TRUE.equals(comparison)) {
        throw invalid(type, "comparison must be true");
      }
      return;
    }

    Map<String, Object> payload = asMap(type, comparison);
    switch (type) {
      case EVENT_FREQUENCY_COUNT, PERCENT_SESSIONS_COUNT -> {
        allowOnly(type, payload, Set.of("interval", "value"));
        checkFrequency(type, payload, false);
      }
      case EVENT_FREQUENCY_PERCENT, PERCENT_SESSIONS_PERCENT -> {
        allowOnly(type, payload, Set.of("interval", "value", "comparison_interval"));
        checkFrequency(type, payload, true);
      }
      case EVENT_UNIQUE_USER_FREQUENCY_COUNT -> {
        allowOnly(type, payload, Set.of("interval", "value", "filters"));
        checkFrequency(type, payload, false);
        checkFolded(type, payload.get("filters"));
      }
      case EVENT_UNIQUE_USER_FREQUENCY_PERCENT -> {
        allowOnly(type, payload, Set.of("interval", "value", "comparison_interval", "filters"));
        checkFrequency(type, payload, true);
        checkFolded(type, payload.get("filters"));
      }
      case TAGGED_EVENT -> checkMatch(type, payload, "key");
      case EVENT_ATTRIBUTE -> checkMatch(type, payload, "attribute");
      case LEVEL -> {
        allowOnly(type, payload, Set.of("level", "match"));
        requireOneOf(type, payload, "level", LEVELS);
        requireOneOf(type, payload, "match", LEVEL_MATCHES);
      }
      case AGE_COMPARISON -> {
        allowOnly(type, payload, Set.of("comparison_type", "value", "time"));
        requireOneOf(type, payload, "comparison_type", AGE_COMPARISON_TYPES);
        requireNonNegativeInt(type, payload, "value");
        requireOneOf(type, payload, "time", AGE_UNITS);
      }
      case ISSUE_OCCURRENCES -> {
        allowOnly(type, payload, Set.of("value"));
        requireNonNegativeInt(type, payload, "value");
      }
      case ASSIGNED_TO -> {
        allowOnly(type, payload, Set.of("target_type", "target_identifier"));
        requireOneOf(type, payload, "target_type", ASSIGNEE_TYPES);
        if (!"Unassigned".equals(payload.get("target_type"))
            && payload.get("target_identifier") == null) {
          throw invalid(type, "target_identifier is required for " + payload.get("target_type"));
        }
      }
      case ISSUE_CATEGORY -> {
        allowOnly(type, payload, Set.of("value"));
        if (requireNonNegativeInt(type, payload, "value") < 1) {
          throw invalid(type, "value must be a positive category id");
        }
      }
      default -> throw invalid(type, "no schema registered");
    }
  }

  public void validateWorkflowConfig(Map<String, Object> config) {
    if (config == null) {
      throw invalid("workflow", "config is required");
    }
    allowOnly("workflow", config, Set.of("frequency"));
    Object frequency = config.get("frequency");
    if (!(frequency instanceof Integer minutes) || minutes < 0 || minutes > MAX_FREQUENCY_MINUTES) {
      throw invalid("workflow",
          "frequency must be an integer between 0 and " + MAX_FREQUENCY_MINUTES + ": " + frequency);
    }
  }

  private void checkFrequency(ConditionType type, Map<String, Object> payload, boolean percent) {
    requireOneOf(type, payload, "interval", INTERVALS);
    Object value = payload.get("value");
    if (!(value instanceof Number number) || number.doubleValue() < 0) {
      throw invalid(type, "value must be a non-negative number: " + value);
    }
    if (percent) {
      requireOneOf(type, payload, "comparison_interval", COMPARISON_INTERVALS);
    }
  }

  private void checkFolded(ConditionType type, Object filters) {
    if (filters == null) {
      return;
    }
    if (!(filters instanceof List<?> list)) {
      throw invalid(type, "filters must be a list");
    }
    for (Object filter : list) {
      Map<String, Object> payload = asMap(type, filter);
      checkMatch(type, payload, payload.containsKey("attribute") ? "attribute" : "key");
    }
  }

  private void checkMatch(ConditionType type, Map<String, Object> payload, String subjectKey) {
    allowOnly(type, payload, Set.of(subjectKey, "match", "value"));
    if (!(payload.get(subjectKey) instanceof String subject) || subject.isBlank()) {
      throw invalid(type, subjectKey + " must be a non-empty string");
    }
    Object code = payload.get("match");
    MatchType match = MatchType.fromCode(code instanceof String s ? s : null)
        .orElseThrow(() -> invalid(type, "unknown match: " + code));
    if (match.requiresValue() && !(payload.get("value") instanceof String)) {
      throw invalid(type, "value is required for match " + match.code());
    }
  }

  private int requireNonNegativeInt(ConditionType type, Map<String, Object> payload, String key) {
    Object value = payload.get(key);
    if (!(value instanceof Integer number) || number < 0) {
      throw invalid(type, key + " must be a non-negative integer: " + value);
    }
    return number;
  }

  private void requireOneOf(ConditionType type, Map<String, Object> payload, String key,
                            Set<?> allowed) {
    Object value = payload.get(key);
    if (value == null || !allowed.contains(value)) {
      throw invalid(type, key + " must be one of " + allowed + " but was " + value);
    }
  }

  private void allowOnly(Object subject, Map<String, Object> payload, Set<String> allowed) {
    for (String key : payload.keySet()) {
      if (!allowed.contains(key)) {
        throw invalid(subject, "unexpected property '" + key + "'");
      }
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> asMap(ConditionType type, Object comparison) {
    if (!(comparison instanceof Map<?, ?> map)) {
      throw invalid(type, "comparison must be an object");
    }
    return (Map<String, Object>) map;
  }

  private ConditionTranslationException invalid(Object subject, String message) {
    return new ConditionTranslationException(String.valueOf(subject),
        "Schema validation failed for " + subject + ": " + message);
  }
}
