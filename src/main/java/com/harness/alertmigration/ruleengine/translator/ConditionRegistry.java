package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionRole;
import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Classification and translation table for legacy condition discriminators.
 *
 * <p>Each discriminator is registered with its {@link ConditionRole} and a
 * {@link ConditionTranslator}. Unregistered discriminators are treated as trigger conditions and
 * fail translation, so a rule referencing them never silently loses a condition.
 */
@Component
public class ConditionRegistry {

  public record Registration(ConditionRole role, ConditionTranslator translator) {}

  public record SplitConditions(
      List<Map<String, Object>> conditions,
      List<Map<String, Object>> filters
  ) {}

  private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
  private final UniqueUserFrequencyWithConditionsTranslator uniqueUserWithConditions =
      new UniqueUserFrequencyWithConditionsTranslator();

  public ConditionRegistry() {
    registerDefaults();
  }

  public void register(String id, ConditionRole role, ConditionTranslator translator) {
    registrations.put(id, new Registration(role, translator));
  }

  public Optional<Registration> lookup(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(registrations.get(id));
  }

  public SplitConditions split(List<Map<String, Object>> specs) {
    List<Map<String, Object>> conditions = new ArrayList<>();
    List<Map<String, Object>> filters = new ArrayList<>();
    if (specs != null) {
      for (Map<String, Object> spec : specs) {
        ConditionRole role = lookup(SpecValues.id(spec))
            .map(Registration::role)
            .orElse(ConditionRole.CONDITION);
        if (role == ConditionRole.FILTER) {
          filters.add(spec);
        } else {
          conditions.add(spec);
        }
      }
    }
    return new SplitConditions(List.copyOf(conditions), List.copyOf(filters));
  }

  public DataConditionDto translate(Map<String, Object> spec) {
    String id = SpecValues.id(spec);
    Registration registration = lookup(id)
        .orElseThrow(() -> new ConditionTranslationException(id, "Unsupported condition: " + id));
    return registration.translator().translate(spec);
  }

  /** Translates the unique-user frequency condition that absorbs the rule's filters. */
  public DataConditionDto translateWithFilters(Map<String, Object> spec,
                                               List<Map<String, Object>> filters) {
    return uniqueUserWithConditions.translate(spec, filters);
  }

  private void registerDefaults() {
    register(LegacyConditionIds.EVERY_EVENT, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.EVERY_EVENT));
    register(LegacyConditionIds.FIRST_SEEN_EVENT, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.FIRST_SEEN_EVENT));
    register(LegacyConditionIds.REGRESSION_EVENT, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.REGRESSION_EVENT));
    register(LegacyConditionIds.REAPPEARED_EVENT, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.REAPPEARED_EVENT));
    register(LegacyConditionIds.EXISTING_HIGH_PRIORITY_ISSUE, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.EXISTING_HIGH_PRIORITY_ISSUE));
    register(LegacyConditionIds.NEW_HIGH_PRIORITY_ISSUE, ConditionRole.CONDITION,
        new FlagConditionTranslator(ConditionType.NEW_HIGH_PRIORITY_ISSUE));
    register(LegacyConditionIds.EVENT_FREQUENCY, ConditionRole.CONDITION,
        new FrequencyConditionTranslator(
            ConditionType.EVENT_FREQUENCY_COUNT, ConditionType.EVENT_FREQUENCY_PERCENT));
    register(LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY, ConditionRole.CONDITION,
        new FrequencyConditionTranslator(
            ConditionType.EVENT_UNIQUE_USER_FREQUENCY_COUNT,
            ConditionType.EVENT_UNIQUE_USER_FREQUENCY_PERCENT));
    register(LegacyConditionIds.EVENT_FREQUENCY_PERCENT, ConditionRole.CONDITION,
        new FrequencyConditionTranslator(
            ConditionType.PERCENT_SESSIONS_COUNT, ConditionType.PERCENT_SESSIONS_PERCENT));
    register(LegacyConditionIds.EVENT_UNIQUE_USER_FREQUENCY_WITH_CONDITIONS, ConditionRole.CONDITION,
        spec -> uniqueUserWithConditions.translate(spec, List.of()));

    register(LegacyConditionIds.TAGGED_EVENT, ConditionRole.FILTER,
        new MatchFilterTranslator(ConditionType.TAGGED_EVENT, "key"));
    register(LegacyConditionIds.EVENT_ATTRIBUTE, ConditionRole.FILTER,
        new MatchFilterTranslator(ConditionType.EVENT_ATTRIBUTE, "attribute"));
    register(LegacyConditionIds.LEVEL, ConditionRole.FILTER, IssueFilterTranslators.level());
    register(LegacyConditionIds.AGE_COMPARISON, ConditionRole.FILTER,
        IssueFilterTranslators.ageComparison());
    register(LegacyConditionIds.ISSUE_OCCURRENCES, ConditionRole.FILTER,
        IssueFilterTranslators.issueOccurrences());
    register(LegacyConditionIds.LATEST_RELEASE, ConditionRole.FILTER,
        new FlagConditionTranslator(ConditionType.LATEST_RELEASE));
    register(LegacyConditionIds.ASSIGNED_TO, ConditionRole.FILTER,
        IssueFilterTranslators.assignedTo());
    register(LegacyConditionIds.ISSUE_CATEGORY, ConditionRole.FILTER,
        IssueFilterTranslators.issueCategory());
  }
}
