package com.harness.alertmigration.ruleengine.action;

import com.harness.alertmigration.enums.ActionType;
import com.harness.alertmigration.exception.ConditionTranslationException;
import com.harness.alertmigration.model.ActionDto;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationActionBuilderTest {

  private final NotificationActionBuilder builder = new NotificationActionBuilder();

  @Test
  void emailToIssueOwnersKeepsFallthrough() {
    ActionDto action = builder.buildOne(Map.of(
        "id", NotificationActionBuilder.EMAIL_ACTION,
        "targetType", "IssueOwners",
        "fallthroughType", "AllMembers"));

    assertThat(action.type()).isEqualTo(ActionType.EMAIL);
    assertThat(action.config()).containsEntry("target_type", "IssueOwners");
    assertThat(action.data()).containsEntry("fallthrough_type", "AllMembers");
  }

  @Test
  void slackActionUsesWorkspaceAsIntegration() {
    ActionDto action = builder.buildOne(Map.of(
        "id", NotificationActionBuilder.SLACK_ACTION,
        "workspace", "42",
        "channel", "#alerts",
        "channel_id", "C123",
        "tags", "environment,level"));

    assertThat(action.type()).isEqualTo(ActionType.SLACK);
    assertThat(action.integrationId()).isEqualTo("42");
    assertThat(action.config())
        .containsEntry("target_identifier", "C123")
        .containsEntry("target_display", "#alerts");
    assertThat(action.data()).containsEntry("tags", "environment,level");
  }

  @Test
  void pagerDutyWithoutServiceIsRejected() {
    assertThatThrownBy(() -> builder.buildOne(Map.of(
        "id", NotificationActionBuilder.PAGERDUTY_ACTION,
        "account", "7")))
        .isInstanceOf(ConditionTranslationException.class)
        .hasMessageContaining("service");
  }

  @Test
  void buildSkipsActionsThatCannotBeConverted() {
    List<ActionDto> actions = builder.build(1L, List.of(
        Map.of("id", NotificationActionBuilder.PLUGIN_ACTION),
        Map.of("id", "sentry.rules.actions.Unknown"),
        Map.of("id", NotificationActionBuilder.SERVICE_ACTION, "service", "mail")));

    assertThat(actions)
        .extracting(ActionDto::type)
        .containsExactly(ActionType.PLUGIN, ActionType.WEBHOOK);
  }
}
