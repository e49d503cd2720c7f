package com.example.commitnotifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Commit Notifier Application
 * <p>
 * Tracks commit activity across registered GitHub repositories and
 * delivers notifications to a Telegram chat.
 * <p>
 * Features:
 * - Per-repository notification intervals with due-time polling
 * - Distributed scheduler lock so only one instance runs a cycle at a time
 * - Retry with exponential backoff per repository
 * - Commit dedup ledger so each commit is notified at most once
 * - Slack alerting when a repository keeps failing
 */
@EnableScheduling
@SpringBootApplication
public class CommitNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommitNotifierApplication.class, args);
    }
}
