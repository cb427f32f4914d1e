package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.ActionType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ActionDto(
    Long id,
    ActionType type,
    String integrationId,
    Map<String, Object> config,
    Map<String, Object> data
) {

  public ActionDto {
    // values such as target_identifier may legitimately be null
    config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public ActionDto withId(Long newId) {
    return new ActionDto(newId, type, integrationId, config, data);
  }
}
