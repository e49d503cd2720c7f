package com.example.commitnotifier.domain.repository;

import com.example.commitnotifier.domain.entity.NotifiedCommit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for the notified-commit ledger
 */
@Repository
public interface NotifiedCommitRepository extends JpaRepository<NotifiedCommit, Long> {

    /**
     * SHAs from the given set that are already in the ledger
     */
    @Query("SELECT c.sha FROM NotifiedCommit c WHERE c.sha IN :shas")
    List<String> findExistingShas(@Param("shas") Collection<String> shas);

    /**
     * Idempotent insert; a SHA already in the ledger is left untouched
     *
     * @return 1 if inserted, 0 if the SHA was already present
     */
    @Modifying
    @Query(value = """
            INSERT INTO notified_commits
              (sha, repository_id, author_name, author_email, message, commit_date, html_url, notified_at)
            VALUES (:sha, :repositoryId, :authorName, :authorEmail, :message, :commitDate, :htmlUrl, :notifiedAt)
            ON CONFLICT (sha) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("sha") String sha,
                       @Param("repositoryId") Long repositoryId,
                       @Param("authorName") String authorName,
                       @Param("authorEmail") String authorEmail,
                       @Param("message") String message,
                       @Param("commitDate") Instant commitDate,
                       @Param("htmlUrl") String htmlUrl,
                       @Param("notifiedAt") Instant notifiedAt);

    /**
     * Delete ledger entries notified before the cutoff
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM NotifiedCommit c WHERE c.notifiedAt < :cutoff")
    int deleteNotifiedBefore(@Param("cutoff") Instant cutoff);

    long countByRepositoryId(Long repositoryId);
}
