package com.example.commitnotifier.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Dedup ledger entry: a commit whose notification has been delivered.
 * Written once, after delivery, and never updated.
 */
@Entity
@Table(name = "notified_commits", indexes = {
        @Index(name = "idx_notified_commits_repository_id", columnList = "repository_id"),
        @Index(name = "idx_notified_commits_notified_at", columnList = "notified_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotifiedCommit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "sha", nullable = false, unique = true, length = 40)
    private String sha;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "author_name")
    private String authorName;

    @Column(name = "author_email")
    private String authorEmail;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "commit_date")
    private Instant commitDate;

    @Column(name = "html_url", length = 500)
    private String htmlUrl;

    @Column(name = "notified_at", nullable = false)
    private Instant notifiedAt;
}
