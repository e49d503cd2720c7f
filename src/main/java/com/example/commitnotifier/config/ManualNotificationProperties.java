package com.example.commitnotifier.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Limits for manually triggered notification runs
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "commit-notifier.manual")
public class ManualNotificationProperties {

    /**
     * Latest commits sent per repository by the test-notification run
     */
    @Min(1)
    private int testCommitCount = 5;

    /**
     * Maximum repositories covered by one test-notification run
     */
    @Min(1)
    private int testRepositoryLimit = 100;

    /**
     * Default number of commits for a single-repository send
     */
    @Min(1)
    private int sendCommitsDefaultLimit = 10;
}
