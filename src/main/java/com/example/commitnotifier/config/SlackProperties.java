package com.example.commitnotifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties for operator alerts
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#commit-notifier-alerts";
    private boolean enabled = false;

    public boolean isUsable() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
