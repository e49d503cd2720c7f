package com.example.commitnotifier.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * GitHub API configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "github")
public class GitHubProperties {
    private String token;
    @NotBlank
    private String apiBaseUrl = "https://api.github.com";
    private int timeoutSeconds = 30;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
