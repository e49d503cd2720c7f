package com.example.commitnotifier.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Message formatting settings for Telegram notifications
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notification.format")
public class NotificationFormatProperties {

    /**
     * Zone used to render commit and notification timestamps
     */
    @NotBlank
    private String timeZone = "Asia/Ho_Chi_Minh";

    /**
     * Commits listed per chunked message
     */
    @Min(1)
    private int commitsPerMessage = 5;

    @NotNull
    private MultiCommitStyle multiCommitStyle = MultiCommitStyle.CHUNKED;

    public enum MultiCommitStyle {
        /**
         * Pages of commits with continuous numbering, one message per page
         */
        CHUNKED,

        /**
         * Single message with the first few commits and an overflow count
         */
        SUMMARY
    }
}
