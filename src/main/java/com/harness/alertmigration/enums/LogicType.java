package com.harness.alertmigration.enums;

import java.util.Locale;

public enum LogicType {
  ALL("all"),
  ANY("any"),
  ANY_SHORT_CIRCUIT("any-short"),
  NONE("none");

  private final String value;

  LogicType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static LogicType fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Logic type must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (LogicType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown logic type: " + value);
  }
}
