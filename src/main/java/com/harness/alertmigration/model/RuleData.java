package com.harness.alertmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleData(
    @JsonProperty("conditions") List<Map<String, Object>> conditions,
    @JsonProperty("actions") List<Map<String, Object>> actions,
    @JsonProperty("action_match") String actionMatch,
    @JsonProperty("filter_match") String filterMatch,
    @JsonProperty("frequency") Integer frequency
) {}
