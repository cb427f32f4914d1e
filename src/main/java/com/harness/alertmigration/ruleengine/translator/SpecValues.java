package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.exception.ConditionTranslationException;
import java.util.Map;

final class SpecValues {

  static final String ID_KEY = "id";

  private SpecValues() {}

  static String id(Map<String, Object> spec) {
    Object id = spec.get(ID_KEY);
    return id != null ? id.toString() : null;
  }

  static String requireString(Map<String, Object> spec, String key) {
    Object value = spec.get(key);
    if (value == null || value.toString().isBlank()) {
      throw missing(spec, key);
    }
    return value.toString();
  }

  static String optionalString(Map<String, Object> spec, String key) {
    Object value = spec.get(key);
    return value != null ? value.toString() : null;
  }

  static int requireInt(Map<String, Object> spec, String key) {
    Number number = requireNumber(spec, key);
    if (number.doubleValue() != Math.rint(number.doubleValue())) {
      throw new ConditionTranslationException(id(spec),
          "Expected an integer for '" + key + "' but got " + number);
    }
    return number.intValue();
  }

  static Number requireNumber(Map<String, Object> spec, String key) {
    Object value = spec.get(key);
    if (value == null) {
      throw missing(spec, key);
    }
    if (value instanceof Number number) {
      return number;
    }
    try {
      double parsed = Double.parseDouble(value.toString().trim());
      if (parsed == Math.rint(parsed) && Math.abs(parsed) < Integer.MAX_VALUE) {
        return (int) parsed;
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new ConditionTranslationException(id(spec),
          "Expected a number for '" + key + "' but got '" + value + "'", e);
    }
  }

  private static ConditionTranslationException missing(Map<String, Object> spec, String key) {
    return new ConditionTranslationException(id(spec), "Missing required field '" + key + "'");
  }
}
