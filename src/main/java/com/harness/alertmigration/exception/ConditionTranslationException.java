package com.harness.alertmigration.exception;

public class ConditionTranslationException extends RuntimeException {

  private final String specId;

  public ConditionTranslationException(String specId, String message) {
    super(message);
    this.specId = specId;
  }

  public ConditionTranslationException(String specId, String message, Throwable cause) {
    super(message, cause);
    this.specId = specId;
  }

  public String getSpecId() {
    return specId;
  }
}
