package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.LinkedHashMap;
import java.util.Map;

public final class IssueFilterTranslators {

  private IssueFilterTranslators() {}

  public static ConditionTranslator level() {
    return spec -> {
      Map<String, Object> comparison = new LinkedHashMap<>();
      comparison.put("level", SpecValues.requireInt(spec, "level"));
      comparison.put("match", SpecValues.requireString(spec, "match"));
      return DataConditionDto.unsaved(ConditionType.LEVEL, comparison);
    };
  }

  public static ConditionTranslator ageComparison() {
    return spec -> {
      Map<String, Object> comparison = new LinkedHashMap<>();
      comparison.put("comparison_type", SpecValues.requireString(spec, "comparison_type"));
      comparison.put("value", SpecValues.requireInt(spec, "value"));
      comparison.put("time", SpecValues.requireString(spec, "time"));
      return DataConditionDto.unsaved(ConditionType.AGE_COMPARISON, comparison);
    };
  }

  public static ConditionTranslator issueOccurrences() {
    return spec -> DataConditionDto.unsaved(ConditionType.ISSUE_OCCURRENCES,
        Map.of("value", SpecValues.requireInt(spec, "value")));
  }

  public static ConditionTranslator assignedTo() {
    return spec -> {
      Map<String, Object> comparison = new LinkedHashMap<>();
      comparison.put("target_type", SpecValues.requireString(spec, "targetType"));
      comparison.put("target_identifier", spec.get("targetIdentifier"));
      return DataConditionDto.unsaved(ConditionType.ASSIGNED_TO, comparison);
    };
  }

  public static ConditionTranslator issueCategory() {
    return spec -> DataConditionDto.unsaved(ConditionType.ISSUE_CATEGORY,
        Map.of("value", SpecValues.requireInt(spec, "value")));
  }
}
