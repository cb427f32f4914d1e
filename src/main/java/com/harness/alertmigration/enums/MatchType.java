package com.harness.alertmigration.enums;

import java.util.Arrays;
import java.util.Optional;

public enum MatchType {
  EQUAL("eq"),
  NOT_EQUAL("ne"),
  STARTS_WITH("sw"),
  NOT_STARTS_WITH("nsw"),
  ENDS_WITH("ew"),
  NOT_ENDS_WITH("new"),
  CONTAINS("co"),
  NOT_CONTAINS("nc"),
  IS_SET("is"),
  NOT_SET("ns"),
  IS_IN("in"),
  NOT_IN("nin"),
  GREATER_OR_EQUAL("gte"),
  LESS_OR_EQUAL("lte");

  private final String code;

  MatchType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean requiresValue() {
    return this != IS_SET && this != NOT_SET;
  }

  public static Optional<MatchType> fromCode(String code) {
    return Arrays.stream(values()).filter(m -> m.code.equals(code)).findFirst();
  }
}
