package com.harness.alertmigration.model;

public record DetectorDto(
    Long id,
    Long projectId,
    String type,
    String name
) {

  public static final String ERROR_TYPE = "error";
  public static final String ERROR_DETECTOR_NAME = "Error Monitor";

  public static DetectorDto placeholder(Long projectId) {
    return new DetectorDto(null, projectId, ERROR_TYPE, ERROR_DETECTOR_NAME);
  }

  public boolean isTransient() {
    return id == null;
  }
}
