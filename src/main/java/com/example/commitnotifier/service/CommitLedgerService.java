package com.example.commitnotifier.service;

import com.example.commitnotifier.client.ClientModels.GitHubCommit;
import com.example.commitnotifier.config.LedgerProperties;
import com.example.commitnotifier.domain.repository.NotifiedCommitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Service for the dedup ledger of notified commits.
 * <p>
 * A SHA enters the ledger only after the message carrying it was delivered,
 * and at most once. Entries older than the retention window are purged daily.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitLedgerService {

    private final NotifiedCommitRepository commitRepository;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Commits whose SHA is not yet in the ledger, in fetch order
     */
    @Transactional(readOnly = true)
    public List<GitHubCommit> filterUnnotified(List<GitHubCommit> commits) {
        if (commits.isEmpty()) {
            return commits;
        }

        var shas = commits.stream()
                .map(GitHubCommit::getSha)
                .filter(Objects::nonNull)
                .toList();
        var notified = shas.isEmpty() ? Set.<String>of() : new HashSet<>(commitRepository.findExistingShas(shas));

        return commits.stream()
                .filter(commit -> commit.getSha() != null && !notified.contains(commit.getSha()))
                .toList();
    }

    /**
     * Record delivered commits. SHAs already present are left untouched.
     *
     * @return number of new ledger entries
     */
    @Transactional
    public int recordNotified(Long repositoryId, List<GitHubCommit> commits) {
        var now = clock.instant();
        var inserted = 0;
        for (var commit : commits) {
            inserted += commitRepository.insertIfAbsent(
                    commit.getSha(),
                    repositoryId,
                    commit.authorName(),
                    commit.authorEmail(),
                    commit.message(),
                    parseCommitDate(commit.authorDate()),
                    commit.getHtmlUrl(),
                    now);
        }
        log.debug("Recorded {} of {} commits for repository {}", inserted, commits.size(), repositoryId);
        return inserted;
    }

    /**
     * Delete ledger entries older than the retention window
     */
    @Scheduled(cron = "${commit-notifier.ledger.cleanup-cron:0 30 3 * * *}")
    @SchedulerLock(name = "notifiedCommitCleanup", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public int purgeExpired() {
        try {
            var cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
            var deleted = commitRepository.deleteNotifiedBefore(cutoff);
            if (deleted > 0) {
                log.info("Purged {} notified commits older than {} days", deleted, properties.getRetentionDays());
            } else {
                log.debug("No notified commits to purge");
            }
            return deleted;
        } catch (Exception e) {
            log.error("Error purging notified commits: {}", e.getMessage(), e);
            return 0;
        }
    }

    private static Instant parseCommitDate(String isoTimestamp) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(isoTimestamp).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable commit date {}", isoTimestamp);
            return null;
        }
    }
}
