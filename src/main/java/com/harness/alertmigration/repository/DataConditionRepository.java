package com.harness.alertmigration.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DataConditionRepository extends JpaRepository<DataConditionEntity, Long> {

  List<DataConditionEntity> findByConditionGroupId(Long conditionGroupId);
}
