package com.harness.alertmigration.ruleengine.translator;

import com.harness.alertmigration.model.DataConditionDto;
import java.util.Map;

@FunctionalInterface
public interface ConditionTranslator {

  DataConditionDto translate(Map<String, Object> spec);
}
