package com.example.commitnotifier.service.alert;

import com.example.commitnotifier.config.SlackProperties;
import com.example.commitnotifier.domain.entity.TrackedRepository;
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
import java.util.Arrays;
import java.util.List;

/**
 * Sends operator alerts to Slack when notification delivery keeps failing.
 * <p>
 * Alerts are best effort: a Slack failure is logged and never reaches the scheduler.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:commit-notifier}")
    private String applicationName = "commit-notifier";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * A repository failed on every attempt of a cycle; it stays due for the next one.
     */
    @Async
    public void sendRetriesExhaustedAlert(TrackedRepository repository, int attempts, String lastError) {
        if (!slackProperties.isUsable()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Repository {} failed {} attempts but no alert was sent.",
                    repository.getRepoString(), attempts);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Commit notification failed after " + attempts + " attempts*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(repository.getRepoString())
                                .titleLink("https://github.com/" + repository.getOwner() + "/" + repository.getRepo())
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Repository ID")
                                                .value(String.valueOf(repository.getId()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Next Check")
                                                .value(String.valueOf(repository.getNextCheckTime()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | The repository stays due and is retried next cycle")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "retries exhausted for " + repository.getRepoString());
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!slackProperties.isUsable()) {
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

        send(payload, title);
    }

    private void send(Payload payload, String description) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert ({}). Response code: {}, body: {}",
                        description, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent: {}", description);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert ({}): {}", description, e.getMessage(), e);
        }
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
