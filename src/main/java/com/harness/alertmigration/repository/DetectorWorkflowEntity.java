package com.harness.alertmigration.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "detector_workflows")
public class DetectorWorkflowEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "detector_id", nullable = false)
  private Long detectorId;

  @Column(name = "workflow_id", nullable = false)
  private Long workflowId;

  public DetectorWorkflowEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getDetectorId() {
    return detectorId;
  }

  public void setDetectorId(Long detectorId) {
    this.detectorId = detectorId;
  }

  public Long getWorkflowId() {
    return workflowId;
  }

  public void setWorkflowId(Long workflowId) {
    this.workflowId = workflowId;
  }
}
