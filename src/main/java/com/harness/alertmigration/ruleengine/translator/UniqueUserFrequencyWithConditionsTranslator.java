package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The unique-user frequency condition that carries its own filters. The rule's filters are folded
 * into the condition's comparison, so they must not be migrated a second time as "if" conditions.
 * Only tag and event-attribute filters can be folded in.
 */
public class UniqueUserFrequencyWithConditionsTranslator {

  private final FrequencyConditionTranslator frequency = new FrequencyConditionTranslator(
      ConditionType.EVENT_UNIQUE_USER_FREQUENCY_COUNT,
      ConditionType.EVENT_UNIQUE_USER_FREQUENCY_PERCENT);
  private final MatchFilterTranslator taggedEvent =
      new MatchFilterTranslator(ConditionType.TAGGED_EVENT, "key");
  private final MatchFilterTranslator eventAttribute =
      new MatchFilterTranslator(ConditionType.EVENT_ATTRIBUTE, "attribute");

  public DataConditionDto translate(Map<String, Object> spec, List<Map<String, Object>> filters) {
    ConditionType type = frequency.resolveType(spec);
    Map<String, Object> comparison = frequency.buildComparison(spec);

    List<Map<String, Object>> folded = new ArrayList<>();
    if (filters != null) {
      for (Map<String, Object> filter : filters) {
        folded.add(foldFilter(filter));
      }
    }
    comparison.put("filters", folded);
    return DataConditionDto.unsaved(type, comparison);
  }

  private Map<String, Object> foldFilter(Map<String, Object> filter) {
    String filterId = SpecValues.id(filter);
    if (LegacyConditionIds.TAGGED_EVENT.equals(filterId)) {
      return taggedEvent.buildComparison(filter);
    }
    if (LegacyConditionIds.EVENT_ATTRIBUTE.equals(filterId)) {
      return eventAttribute.buildComparison(filter);
    }
    throw new ConditionTranslationException(filterId,
        "Filter " + filterId + " cannot be combined with a unique user frequency condition");
  }
}
