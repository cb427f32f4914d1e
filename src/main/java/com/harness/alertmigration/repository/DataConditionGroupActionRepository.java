package com.harness.alertmigration.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DataConditionGroupActionRepository
    extends JpaRepository<DataConditionGroupActionEntity, Long> {

  List<DataConditionGroupActionEntity> findByConditionGroupId(Long conditionGroupId);
}
