package com.harness.alertmigration.repository;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DataConditionGroupRepository extends JpaRepository<DataConditionGroupEntity, Long> {
}
