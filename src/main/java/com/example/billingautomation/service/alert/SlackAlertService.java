package com.example.billingautomation.service.alert;

import com.example.billingautomation.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Sends on-call alerts to Slack for overdue escalations and failed billing runs.
 * <p>
 * Alerts are best effort: a disabled or failing webhook is logged and never
 * interrupts the sweep that raised the alert.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:billing-automation}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Post an escalation for an account that has been overdue for too long.
     * Runs asynchronously to not block the sweep.
     */
    @Async
    public void sendEscalationAlert(String title, String message) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Escalation not posted: {}", title);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Escalation: " + title + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .text(message)
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/invoices?status=overdue")
                                .title("Overdue invoices")
                                .footer(applicationName + " | Please follow up with the tenant")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "escalation " + title);
    }

    /**
     * Post a generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *" + title + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .text(message)
                                .fields(details != null ? List.of(
                                        Field.builder()
                                                .title("Details")
                                                .value(truncate(details, 500))
                                                .valueShortEnough(false)
                                                .build()
                                ) : List.of())
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "error " + title);
    }

    private void send(Payload payload, String description) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack {}. Response code: {}, body: {}", description, response.getCode(), response.getBody());
            } else {
                log.info("Slack {} sent", description);
            }
        } catch (Exception e) {
            log.error("Error sending Slack {}: {}", description, e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
