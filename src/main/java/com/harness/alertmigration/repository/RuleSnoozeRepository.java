package com.harness.alertmigration.repository;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleSnoozeRepository extends JpaRepository<RuleSnoozeEntity, Long> {

  // organization-wide (no user) and open-ended (no expiry)
  boolean existsByRuleIdAndUserIdIsNullAndUntilIsNull(Long ruleId);
}
