package com.harness.alertmigration.repository;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertRuleWorkflowRepository extends JpaRepository<AlertRuleWorkflowEntity, Long> {

  boolean existsByRuleId(Long ruleId);

  Optional<AlertRuleWorkflowEntity> findByRuleId(Long ruleId);
}
