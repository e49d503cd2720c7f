package com.example.commitnotifier.domain.entity;

import com.example.commitnotifier.domain.RepositoryCoordinates;
import com.example.commitnotifier.domain.enums.NotificationInterval;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A GitHub repository (optionally pinned to a branch) whose commits are notified.
 * <p>
 * Scheduling state:
 * - {@code nextCheckTime} is set on registration and never null afterwards
 * - once checked, {@code nextCheckTime = lastCheckTime + notificationInterval}
 * - only the notification scheduler advances the two timestamps
 */
@Entity
@Table(name = "repositories", indexes = {
        @Index(name = "idx_repos_next_check_time", columnList = "next_check_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackedRepository {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Canonical "owner/repo" or "owner/repo:branch"
     */
    @Column(name = "repo_string", nullable = false, unique = true)
    private String repoString;

    @Column(name = "owner", nullable = false)
    private String owner;

    @Column(name = "repo", nullable = false)
    private String repo;

    @Column(name = "branch")
    private String branch;

    @Column(name = "notification_interval", nullable = false)
    @Builder.Default
    private NotificationInterval notificationInterval = NotificationInterval.DEFAULT;

    /**
     * Start of the last successful check; commits are fetched since this instant
     */
    @Column(name = "last_check_time")
    private Instant lastCheckTime;

    /**
     * When the repository becomes due again
     */
    @Column(name = "next_check_time", nullable = false)
    private Instant nextCheckTime;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.notificationInterval == null) {
            this.notificationInterval = NotificationInterval.DEFAULT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public RepositoryCoordinates getCoordinates() {
        return new RepositoryCoordinates(owner, repo, branch);
    }

    /**
     * Check if the repository is due at the given instant
     */
    public boolean isDue(Instant now) {
        return nextCheckTime != null && !nextCheckTime.isAfter(now);
    }

    /**
     * Next check time after a check that started at {@code checkedAt}
     */
    public Instant nextCheckAfter(Instant checkedAt) {
        return checkedAt.plus(notificationInterval.toDuration());
    }
}
