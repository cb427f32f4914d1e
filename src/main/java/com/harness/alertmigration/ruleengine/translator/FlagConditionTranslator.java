package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.enums.ConditionType;
import com.harness.alertmigration.model.DataConditionDto;
import java.util.Map;

public class FlagConditionTranslator implements ConditionTranslator {

  private final ConditionType type;

  public FlagConditionTranslator(ConditionType type) {
    this.type = type;
  }

  @Override
  public DataConditionDto translate(Map<String, Object> spec) {
    return DataConditionDto.unsaved(type, Boolean.TRUE);
  }
}
