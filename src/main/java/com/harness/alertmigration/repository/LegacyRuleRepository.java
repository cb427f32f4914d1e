package com.harness.alertmigration.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LegacyRuleRepository extends JpaRepository<LegacyRuleEntity, Long> {

  List<LegacyRuleEntity> findByProjectIdOrderByIdAsc(Long projectId);
}
