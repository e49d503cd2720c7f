package com.example.commitnotifier.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request/Response DTOs for the GitHub and Telegram clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === GitHub Models ===

    /**
     * Item of GET /repos/{owner}/{repo}/commits
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubCommit {
        private String sha;
        private CommitDetail commit;
        @JsonProperty("html_url")
        private String htmlUrl;
        private GitHubUser author;

        public String shortSha() {
            if (sha == null || sha.isEmpty()) {
                return "unknown";
            }
            return sha.length() > 7 ? sha.substring(0, 7) : sha;
        }

        public String message() {
            return commit != null ? commit.getMessage() : null;
        }

        public String authorName() {
            return commit != null && commit.getAuthor() != null ? commit.getAuthor().getName() : null;
        }

        public String authorEmail() {
            return commit != null && commit.getAuthor() != null ? commit.getAuthor().getEmail() : null;
        }

        public String authorDate() {
            return commit != null && commit.getAuthor() != null ? commit.getAuthor().getDate() : null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CommitDetail {
        private String message;
        private CommitAuthor author;
        private String url;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CommitAuthor {
        private String name;
        private String email;
        /**
         * ISO-8601 timestamp as sent by GitHub
         */
        private String date;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubUser {
        private String login;
    }

    /**
     * Body of GET /rate_limit
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimitResponse {
        private Rate rate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rate {
        private int limit;
        private int remaining;
        /**
         * Epoch seconds when the quota resets
         */
        private long reset;
    }

    /**
     * API quota reported by the commit source
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimitStatus {
        private int limit;
        private int remaining;
        private Instant resetTime;
    }

    // === Telegram Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TelegramSendMessageRequest {
        @JsonProperty("chat_id")
        private String chatId;
        private String text;
        @JsonProperty("parse_mode")
        private String parseMode;
        @JsonProperty("disable_web_page_preview")
        private boolean disableWebPagePreview;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TelegramResponse {
        private boolean ok;
        @JsonProperty("error_code")
        private Integer errorCode;
        private String description;
    }
}
