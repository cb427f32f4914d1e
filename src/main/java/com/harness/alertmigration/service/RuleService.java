package com.harness.alertmigration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.RuleData;
import com.harness.alertmigration.repository.LegacyRuleEntity;
import com.harness.alertmigration.repository.LegacyRuleRepository;
import com.harness.alertmigration.repository.RuleSnoozeEntity;
import com.harness.alertmigration.repository.RuleSnoozeRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes legacy rules and their snoozes.
 */
@Service
public class RuleService {

  private final LegacyRuleRepository repository;
  private final RuleSnoozeRepository snoozeRepository;
  private final ObjectMapper objectMapper;

  public RuleService(LegacyRuleRepository repository,
                     RuleSnoozeRepository snoozeRepository,
                     ObjectMapper objectMapper) {
    this.repository = repository;
    this.snoozeRepository = snoozeRepository;
    this.objectMapper = objectMapper;
  }

  @Transactional
  public LegacyRule createRule(LegacyRule request) {
    LegacyRuleEntity entity = new LegacyRuleEntity();
    entity.setProjectId(request.projectId());
    entity.setOrganizationId(request.organizationId());
    entity.setLabel(request.label());
    entity.setEnvironmentId(request.environmentId());
    entity.setStatus(request.status());
    entity.setSource(request.source());
    entity.setOwnerUserId(request.ownerUserId());
    entity.setOwnerTeamId(request.ownerTeamId());
    entity.setDataJson(serializeData(new RuleData(
        request.conditions(),
        request.actions(),
        request.actionMatch(),
        request.filterMatch(),
        request.frequency()
    )));
    entity.setDateAdded(request.dateAdded() != null ? request.dateAdded() : Instant.now());
    return toDto(repository.save(entity));
  }

  @Transactional(readOnly = true)
  public Optional<LegacyRule> getRule(Long ruleId) {
    return repository.findById(ruleId).map(this::toDto);
  }

  @Transactional(readOnly = true)
  public List<LegacyRule> listRulesForProject(Long projectId) {
    return repository.findByProjectIdOrderByIdAsc(projectId).stream().map(this::toDto).toList();
  }

  /**
   * Snoozes a rule. A null {@code userId} snoozes it for the whole organization, a null
   * {@code until} snoozes it until it is manually unsnoozed.
   */
  @Transactional
  public void snoozeRule(Long ruleId, Long userId, Instant until) {
    RuleSnoozeEntity snooze = new RuleSnoozeEntity();
    snooze.setRuleId(ruleId);
    snooze.setUserId(userId);
    snooze.setUntil(until);
    snoozeRepository.save(snooze);
  }

  @Transactional(readOnly = true)
  public boolean isPermanentlySnoozed(Long ruleId) {
    if (ruleId == null) {
      return false;
    }
    return snoozeRepository.existsByRuleIdAndUserIdIsNullAndUntilIsNull(ruleId);
  }

  private String serializeData(RuleData data) {
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize rule data", e);
    }
  }

  private RuleData deserializeData(String json) {
    try {
      return objectMapper.readValue(json, RuleData.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to deserialize rule data", e);
    }
  }

  private LegacyRule toDto(LegacyRuleEntity entity) {
    RuleData data = deserializeData(entity.getDataJson());
    return new LegacyRule(
        entity.getId(),
        entity.getProjectId(),
        entity.getOrganizationId(),
        entity.getLabel(),
        entity.getEnvironmentId(),
        data.conditions(),
        data.actions(),
        data.actionMatch(),
        data.filterMatch(),
        data.frequency(),
        entity.getStatus(),
        entity.getSource(),
        entity.getOwnerUserId(),
        entity.getOwnerTeamId(),
        entity.getDateAdded()
    );
  }
}
