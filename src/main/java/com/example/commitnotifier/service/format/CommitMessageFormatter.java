package com.example.commitnotifier.service.format;

import com.example.commitnotifier.client.ClientModels.GitHubCommit;
import com.example.commitnotifier.config.NotificationFormatProperties;
import com.example.commitnotifier.config.NotificationFormatProperties.MultiCommitStyle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds Telegram HTML messages for newly found commits.
 * <p>
 * Every piece of user-supplied text (commit titles and bodies, author names,
 * repository names) goes through {@link #escapeHtml(String)}. Timestamps are
 * rendered in the configured zone.
 */
@Component
public class CommitMessageFormatter {

    static final int BODY_EXCERPT_LENGTH = 200;
    static final int SUMMARY_COMMIT_COUNT = 5;

    private static final String DIVIDER = "━━━━━━━━━━━━━━━━";
    private static final String GITHUB_BASE_URL = "https://github.com/";
    private static final DateTimeFormatter COMMIT_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final DateTimeFormatter FOOTER_TIME = DateTimeFormatter.ofPattern("HH:mm dd/MM");

    private final NotificationFormatProperties properties;
    private final Clock clock;
    private final ZoneId zone;

    public CommitMessageFormatter(NotificationFormatProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    /**
     * Messages for a batch of new commits of one repository, in sending order.
     * One commit gets the detailed format, several get the configured multi-commit style.
     */
    public List<String> format(List<GitHubCommit> commits, String repoString) {
        return formatMessages(commits, repoString).stream()
                .map(CommitMessage::getText)
                .toList();
    }

    /**
     * Same messages as {@link #format(List, String)}, each paired with the commits it reports.
     * A summary reports every commit of the batch, including the ones it only counts.
     */
    public List<CommitMessage> formatMessages(List<GitHubCommit> commits, String repoString) {
        if (commits == null || commits.isEmpty()) {
            return List.of();
        }
        if (commits.size() == 1) {
            return List.of(new CommitMessage(formatDetailedCommit(commits.get(0), repoString), commits));
        }
        if (properties.getMultiCommitStyle() == MultiCommitStyle.SUMMARY) {
            return List.of(new CommitMessage(formatSummary(commits, repoString), commits));
        }

        var total = commits.size();
        var pageSize = properties.getCommitsPerMessage();
        var messages = new ArrayList<CommitMessage>();
        for (int start = 0; start < total; start += pageSize) {
            var end = Math.min(start + pageSize, total);
            messages.add(new CommitMessage(formatPage(commits, repoString, start, end), commits.subList(start, end)));
        }
        return messages;
    }

    public String formatDetailedCommit(GitHubCommit commit, String repoString) {
        var message = commit.message() != null ? commit.message() : "No message";
        var newline = message.indexOf('\n');
        var title = newline >= 0 ? message.substring(0, newline) : message;
        var body = newline >= 0 ? message.substring(newline + 1).trim() : "";

        var sb = new StringBuilder();
        sb.append("📦 <b>").append(escapeHtml(formatRepoDisplay(repoString))).append("</b>\n");
        sb.append(DIVIDER).append("\n\n");
        sb.append("<b>").append(escapeHtml(title)).append("</b>\n");

        if (!body.isEmpty()) {
            var excerpt = body.length() > BODY_EXCERPT_LENGTH
                    ? body.substring(0, BODY_EXCERPT_LENGTH) + "..."
                    : body;
            sb.append("\n").append(escapeHtml(excerpt)).append("\n");
        }

        sb.append("\n").append(DIVIDER).append("\n");
        sb.append("👤 ").append(escapeHtml(authorOrDefault(commit, "Unknown Author"))).append("\n");
        sb.append("🕐 ").append(formatCommitTime(commit.authorDate())).append("\n\n");
        sb.append("<a href=\"").append(escapeHtml(commitUrl(commit))).append("\">🔗 ")
                .append(commit.shortSha()).append("</a>\n\n");
        sb.append("<i>Notified at ").append(COMMIT_TIME.format(now())).append("</i>");

        return sb.toString();
    }

    /**
     * Single message listing the first few commits and how many were left out
     */
    public String formatSummary(List<GitHubCommit> commits, String repoString) {
        var count = commits.size();
        var sb = new StringBuilder();
        sb.append("📢 <b>").append(count).append(count == 1 ? " new commit" : " new commits")
                .append("</b> in ").append(repoLink(repoString)).append("\n\n");

        for (int i = 0; i < Math.min(count, SUMMARY_COMMIT_COUNT); i++) {
            var commit = commits.get(i);
            sb.append(i + 1).append(". <b>").append(escapeHtml(title(commit))).append("</b>\n");
            sb.append("   by ").append(escapeHtml(authorOrDefault(commit, "Unknown")))
                    .append(" • ").append(commitLink(commit)).append("\n\n");
        }

        if (count > SUMMARY_COMMIT_COUNT) {
            sb.append("... and ").append(count - SUMMARY_COMMIT_COUNT).append(" more commits\n");
        }

        sb.append("\n<i>Notified at ").append(COMMIT_TIME.format(now())).append("</i>");
        return sb.toString().trim();
    }

    /**
     * One message per page of commits. Numbering runs 1..N across pages.
     */
    public List<String> formatChunked(List<GitHubCommit> commits, String repoString) {
        var total = commits.size();
        var pageSize = properties.getCommitsPerMessage();
        var messages = new ArrayList<String>();

        for (int start = 0; start < total; start += pageSize) {
            messages.add(formatPage(commits, repoString, start, Math.min(start + pageSize, total)));
        }

        return messages;
    }

    private String formatPage(List<GitHubCommit> commits, String repoString, int start, int end) {
        var total = commits.size();
        var sb = new StringBuilder();
        sb.append("📢 <b>").append(total).append(" commits</b> in ").append(repoLink(repoString)).append("\n");
        sb.append("📋 Showing ").append(start + 1).append("-").append(end).append("/").append(total).append("\n\n");

        for (int i = start; i < end; i++) {
            var commit = commits.get(i);
            sb.append("<b>").append(i + 1).append(".</b> ").append(escapeHtml(title(commit))).append("\n");
            sb.append("   👤 ").append(escapeHtml(authorOrDefault(commit, "Unknown")))
                    .append(" • ").append(commitLink(commit)).append("\n\n");
        }

        sb.append("<i>🕐 ").append(FOOTER_TIME.format(now())).append("</i>");
        return sb.toString();
    }

    /**
     * "owner/repo:branch" becomes "owner/repo (branch)"
     */
    public static String formatRepoDisplay(String repoString) {
        if (repoString == null) {
            return "";
        }
        var colon = repoString.indexOf(':');
        if (colon < 0) {
            return repoString;
        }
        return repoString.substring(0, colon) + " (" + repoString.substring(colon + 1) + ")";
    }

    /**
     * Escapes the characters Telegram's HTML parse mode treats as markup.
     * Other characters, including non-ASCII text, pass through unchanged.
     */
    public static String escapeHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    String formatCommitTime(String isoTimestamp) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return "Unknown date";
        }
        try {
            return COMMIT_TIME.format(OffsetDateTime.parse(isoTimestamp).atZoneSameInstant(zone));
        } catch (DateTimeParseException e) {
            return "Unknown date";
        }
    }

    private String repoLink(String repoString) {
        var colon = repoString.indexOf(':');
        var baseRepo = colon >= 0 ? repoString.substring(0, colon) : repoString;
        return "<a href=\"" + escapeHtml(GITHUB_BASE_URL + baseRepo) + "\">"
                + escapeHtml(formatRepoDisplay(repoString)) + "</a>";
    }

    private String commitLink(GitHubCommit commit) {
        return "<a href=\"" + escapeHtml(commitUrl(commit)) + "\">" + commit.shortSha() + "</a>";
    }

    private static String title(GitHubCommit commit) {
        var message = commit.message();
        if (message == null) {
            return "No message";
        }
        var newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    private static String authorOrDefault(GitHubCommit commit, String fallback) {
        var name = commit.authorName();
        return name != null ? name : fallback;
    }

    private static String commitUrl(GitHubCommit commit) {
        return commit.getHtmlUrl() != null ? commit.getHtmlUrl() : "#";
    }

    private ZonedDateTime now() {
        return Instant.now(clock).atZone(zone);
    }
}
