package com.harness.alertmigration.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DetectorWorkflowRepository extends JpaRepository<DetectorWorkflowEntity, Long> {

  List<DetectorWorkflowEntity> findByWorkflowId(Long workflowId);
}
