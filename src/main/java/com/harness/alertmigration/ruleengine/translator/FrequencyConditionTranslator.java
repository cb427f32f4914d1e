package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frequency conditions come in a "count" and a "percent" flavour, selected by the legacy
 * {@code comparisonType} parameter.
 */
public class FrequencyConditionTranslator implements ConditionTranslator {

  static final String COMPARISON_TYPE_COUNT = "count";
  static final String COMPARISON_TYPE_PERCENT = "percent";

  private final ConditionType countType;
  private final ConditionType percentType;

  public FrequencyConditionTranslator(ConditionType countType, ConditionType percentType) {
    this.countType = countType;
    this.percentType = percentType;
  }

  @Override
  public DataConditionDto translate(Map<String, Object> spec) {
    return DataConditionDto.unsaved(resolveType(spec), buildComparison(spec));
  }

  ConditionType resolveType(Map<String, Object> spec) {
    String comparisonType = SpecValues.optionalString(spec, "comparisonType");
    if (comparisonType == null || COMPARISON_TYPE_COUNT.equals(comparisonType)) {
      return countType;
    }
    if (COMPARISON_TYPE_PERCENT.equals(comparisonType)) {
      return percentType;
    }
    throw new ConditionTranslationException(SpecValues.id(spec),
        "Unsupported comparisonType '" + comparisonType + "'");
  }

  Map<String, Object> buildComparison(Map<String, Object> spec) {
    Map<String, Object> comparison = new LinkedHashMap<>();
    comparison.put("interval", SpecValues.requireString(spec, "interval"));
    comparison.put("value", SpecValues.requireNumber(spec, "value"));
    if (resolveType(spec) == percentType) {
      comparison.put("comparison_interval", SpecValues.requireString(spec, "comparisonInterval"));
    }
    return comparison;
  }
}
