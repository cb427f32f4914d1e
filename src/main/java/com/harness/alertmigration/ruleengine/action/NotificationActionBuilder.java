package com.harness.alertmigration.ruleengine.action;

import com.harness.alertmigration.enums.ActionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.ActionDto;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NotificationActionBuilder {

  private static final Logger log = LoggerFactory.getLogger(NotificationActionBuilder.class);

  public static final String EMAIL_ACTION = "sentry.mail.actions.NotifyEmailAction";
  public static final String SLACK_ACTION =
      "sentry.integrations.slack.notify_action.SlackNotifyServiceAction";
  public static final String MSTEAMS_ACTION =
      "sentry.integrations.msteams.notify_action.MsTeamsNotifyServiceAction";
  public static final String DISCORD_ACTION =
      "sentry.integrations.discord.notify_action.DiscordNotifyServiceAction";
  public static final String PAGERDUTY_ACTION =
      "sentry.integrations.pagerduty.notify_action.PagerDutyNotifyServiceAction";
  public static final String OPSGENIE_ACTION =
      "sentry.integrations.opsgenie.notify_action.OpsgenieNotifyTeamAction";
  public static final String SERVICE_ACTION =
      "sentry.rules.actions.notify_event_service.NotifyEventServiceAction";
  public static final String PLUGIN_ACTION = "sentry.rules.actions.notify_event.NotifyEventAction";

  static final String ISSUE_OWNERS = "IssueOwners";

  public List<ActionDto> build(Long ruleId, List<Map<String, Object>> actionSpecs) {
    List<ActionDto> actions = new ArrayList<>();
    if (actionSpecs == null) {
      return actions;
    }
    for (Map<String, Object> spec : actionSpecs) {
      try {
        actions.add(buildOne(spec));
      } catch (ConditionTranslationException e) {
        log.error("Skipping action {} of rule {}: {}", e.getSpecId(), ruleId, e.getMessage());
      }
    }
    return actions;
  }

  public ActionDto buildOne(Map<String, Object> spec) {
    String id = spec.get("id") != null ? spec.get("id").toString() : null;
    if (id == null) {
      throw new ConditionTranslationException(null, "Action spec has no id");
    }
    return switch (id) {
      case EMAIL_ACTION -> email(spec);
      case SLACK_ACTION -> channelAction(ActionType.SLACK, spec, "workspace", "channel_id", "channel",
          List.of("tags", "notes"));
      case MSTEAMS_ACTION -> channelAction(ActionType.MSTEAMS, spec, "team", "channel_id", "channel",
          List.of());
      case DISCORD_ACTION -> channelAction(ActionType.DISCORD, spec, "server", "channel_id", null,
          List.of("tags"));
      case PAGERDUTY_ACTION -> channelAction(ActionType.PAGERDUTY, spec, "account", "service", null,
          List.of("severity"));
      case OPSGENIE_ACTION -> channelAction(ActionType.OPSGENIE, spec, "account", "team", null,
          List.of("priority"));
      case SERVICE_ACTION -> {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("target_type", "specific");
        config.put("target_identifier", require(spec, id, "service"));
        yield new ActionDto(null, ActionType.WEBHOOK, null, config, Map.of());
      }
      case PLUGIN_ACTION -> new ActionDto(null, ActionType.PLUGIN, null, Map.of(), Map.of());
      default -> throw new ConditionTranslationException(id, "Unsupported action: " + id);
    };
  }

  private ActionDto email(Map<String, Object> spec) {
    String targetType = require(spec, EMAIL_ACTION, "targetType");
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("target_type", targetType);
    config.put("target_identifier", spec.get("targetIdentifier"));
    if (!ISSUE_OWNERS.equals(targetType) && spec.get("targetIdentifier") == null) {
      throw new ConditionTranslationException(EMAIL_ACTION,
          "targetIdentifier is required for email target " + targetType);
    }
    Map<String, Object> data = new LinkedHashMap<>();
    if (ISSUE_OWNERS.equals(targetType)) {
      Object fallthrough = spec.get("fallthroughType");
      data.put("fallthrough_type", fallthrough != null ? fallthrough : "ActiveMembers");
    }
    return new ActionDto(null, ActionType.EMAIL, null, config, data);
  }

  private ActionDto channelAction(ActionType type, Map<String, Object> spec, String integrationKey,
                                  String targetKey, String displayKey, List<String> dataKeys) {
    String id = spec.get("id").toString();
    String integrationId = require(spec, id, integrationKey);
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("target_type", "specific");
    config.put("target_identifier", require(spec, id, targetKey));
    if (displayKey != null) {
      config.put("target_display", spec.get(displayKey));
    }
    Map<String, Object> data = new LinkedHashMap<>();
    for (String key : dataKeys) {
      if (spec.get(key) != null) {
        data.put(key, spec.get(key));
      }
    }
    return new ActionDto(null, type, integrationId, config, data);
  }

  private String require(Map<String, Object> spec, String id, String key) {
    Object value = spec.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new ConditionTranslationException(id, "Action " + id + " is missing '" + key + "'");
    }
    return value.toString();
  }
}
