package com.harness.alertmigration.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowDataConditionGroupRepository
    extends JpaRepository<WorkflowDataConditionGroupEntity, Long> {

  List<WorkflowDataConditionGroupEntity> findByWorkflowId(Long workflowId);
}
