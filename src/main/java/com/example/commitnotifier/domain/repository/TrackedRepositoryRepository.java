package com.example.commitnotifier.domain.repository;

import com.example.commitnotifier.domain.entity.TrackedRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for TrackedRepository entity.
 * <p>
 * The due query is served by the index on next_check_time.
 */
@Repository
public interface TrackedRepositoryRepository extends JpaRepository<TrackedRepository, Long> {

    /**
     * Find repositories whose next check time has passed, oldest-due first
     */
    @Query("""
            SELECT r FROM TrackedRepository r
            WHERE r.nextCheckTime <= :now
            ORDER BY r.nextCheckTime ASC, r.id ASC
            """)
    List<TrackedRepository> findDue(@Param("now") Instant now);

    /**
     * Record a successful check and schedule the next one
     *
     * @return number of rows updated (0 if the repository was deleted meanwhile)
     */
    @Modifying
    @Query("""
            UPDATE TrackedRepository r
            SET r.lastCheckTime = :checkedAt,
                r.nextCheckTime = :nextCheckTime,
                r.updatedAt = :checkedAt
            WHERE r.id = :id
            """)
    int advanceSchedule(@Param("id") Long id,
                        @Param("checkedAt") Instant checkedAt,
                        @Param("nextCheckTime") Instant nextCheckTime);

    long countByNextCheckTimeLessThanEqual(Instant now);

    /**
     * Load a repository and lock its row until the transaction ends, so schedule
     * advances and interval changes never overwrite each other
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM TrackedRepository r WHERE r.id = :id")
    Optional<TrackedRepository> findByIdForUpdate(@Param("id") Long id);

    boolean existsByRepoString(String repoString);

    Page<TrackedRepository> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<TrackedRepository> findByRepoStringContainingIgnoreCaseOrderByCreatedAtDesc(String search, Pageable pageable);
}
