package com.example.commitnotifier.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Retention settings for the notified-commit ledger
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "commit-notifier.ledger")
public class LedgerProperties {

    /**
     * Days a notified commit is kept before it is purged
     */
    @Min(1)
    private int retentionDays = 30;

    /**
     * When the purge job runs; read by the @Scheduled annotation
     */
    private String cleanupCron = "0 30 3 * * *";
}
