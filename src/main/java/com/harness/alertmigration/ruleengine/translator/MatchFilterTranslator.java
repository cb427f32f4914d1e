package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.enums.MatchType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.LinkedHashMap;
import java.util.Map;

public class MatchFilterTranslator implements ConditionTranslator {

  private final ConditionType type;
  private final String subjectKey;

  public MatchFilterTranslator(ConditionType type, String subjectKey) {
    this.type = type;
    this.subjectKey = subjectKey;
  }

  @Override
  public DataConditionDto translate(Map<String, Object> spec) {
    return DataConditionDto.unsaved(type, buildComparison(spec));
  }

  Map<String, Object> buildComparison(Map<String, Object> spec) {
    String subject = SpecValues.requireString(spec, subjectKey);
    String matchCode = SpecValues.requireString(spec, "match");
    MatchType match = MatchType.fromCode(matchCode)
        .orElseThrow(() -> new ConditionTranslationException(SpecValues.id(spec),
            "Unknown match type '" + matchCode + "'"));

    Map<String, Object> comparison = new LinkedHashMap<>();
    comparison.put(subjectKey, subject);
    comparison.put("match", match.code());
    if (match.requiresValue()) {
      comparison.put("value", SpecValues.requireString(spec, "value"));
    }
    return comparison;
  }
}
