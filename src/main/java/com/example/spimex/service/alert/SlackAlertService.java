package com.example.spimex.service.alert;

import com.example.spimex.broker.TaskMessage;
import com.example.spimex.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends on-call alerts to Slack when a task is dead-lettered.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:spimex-trading-service}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert for a task that will not be retried again.
     * Runs asynchronously so the consumer loop is not held up by Slack.
     */
    @Async
    public void sendDeadLetterAlert(TaskMessage message, String errorType) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Task {} was dead-lettered but no alert was sent.", message.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDeadLetterPayload(message, errorType));
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for dead-lettered task {}", message.getId());
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for task {}: {}", message.getId(), e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildDeadLetterPayload(TaskMessage message, String errorType) {
        var lastError = message.getLastError() != null ? message.getLastError() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Task Dead-Lettered - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(message.getType().getDisplayName() + " - " + describePayload(message))
                                .fields(Arrays.asList(
                                        shortField("Task ID", message.getId().toString()),
                                        shortField("Attempts", message.getAttempt() + " of " + message.getMaxRetries()),
                                        shortField("Origin", message.getOrigin()),
                                        shortField("Error Type", errorType != null ? errorType : "unknown"),
                                        shortField("Enqueued At", message.getEnqueuedAt() != null ? DATE_FORMATTER.format(message.getEnqueuedAt()) : "-"),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Inspect the dead-letter list and re-enqueue if needed")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private Field shortField(String title, String value) {
        return Field.builder()
                .title(title)
                .value(value)
                .valueShortEnough(true)
                .build();
    }

    private String describePayload(TaskMessage message) {
        return message.getPayload() == null || message.getPayload().isEmpty() ? "no payload" : message.getPayload().toString();
    }

    private String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
