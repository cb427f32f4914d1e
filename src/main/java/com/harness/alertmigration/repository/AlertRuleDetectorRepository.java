package com.harness.alertmigration.repository;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertRuleDetectorRepository extends JpaRepository<AlertRuleDetectorEntity, Long> {

  Optional<AlertRuleDetectorEntity> findByRuleIdAndDetectorId(Long ruleId, Long detectorId);
}
