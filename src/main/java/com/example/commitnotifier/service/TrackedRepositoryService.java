package com.example.commitnotifier.service;

import com.example.commitnotifier.domain.RepositoryCoordinates;
import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.domain.enums.NotificationInterval;
import com.example.commitnotifier.domain.repository.TrackedRepositoryRepository;
import com.example.commitnotifier.dto.CreateRepositoryRequest;
import com.example.commitnotifier.dto.RepositoryResponse;
import com.example.commitnotifier.exception.DuplicateRepositoryException;
import com.example.commitnotifier.exception.RepositoryNotFoundException;
import com.example.commitnotifier.mapper.RepositoryMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for the set of tracked repositories and their due times.
 * <p>
 * Provides:
 * - Registration with repository string normalization and duplicate detection
 * - Interval changes, which recompute the next check time
 * - The due query and schedule advancement used by the notification scheduler
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackedRepositoryService {

    private final TrackedRepositoryRepository repositoryRepository;
    private final RepositoryMapper repositoryMapper;
    private final Clock clock;

    // === Registration ===

    /**
     * Start tracking a repository. The first check is due one interval from now.
     */
    @Transactional
    public RepositoryResponse register(CreateRepositoryRequest request) {
        var coordinates = RepositoryCoordinates.parse(request.getRepository());
        var interval = request.getNotificationInterval() != null
                ? NotificationInterval.fromHours(request.getNotificationInterval())
                : NotificationInterval.DEFAULT;
        var repoString = coordinates.toRepoString();

        if (repositoryRepository.existsByRepoString(repoString)) {
            throw new DuplicateRepositoryException(repoString);
        }

        var now = clock.instant();
        var repository = TrackedRepository.builder()
                .repoString(repoString)
                .owner(coordinates.getOwner())
                .repo(coordinates.getRepo())
                .branch(coordinates.getBranch())
                .notificationInterval(interval)
                .nextCheckTime(now.plus(interval.toDuration()))
                .build();

        repository = repositoryRepository.save(repository);
        log.info("Registered repository {} (id={}, every {}h)", repoString, repository.getId(), interval.getHours());

        return repositoryMapper.toResponse(repository);
    }

    // === Retrieval ===

    @Transactional(readOnly = true)
    public RepositoryResponse getRepository(Long id) {
        return repositoryMapper.toResponse(findById(id));
    }

    @Transactional(readOnly = true)
    public Page<RepositoryResponse> listRepositories(String search, Pageable pageable) {
        var page = search != null && !search.isBlank()
                ? repositoryRepository.findByRepoStringContainingIgnoreCaseOrderByCreatedAtDesc(search.trim(), pageable)
                : repositoryRepository.findAllByOrderByCreatedAtDesc(pageable);
        return page.map(repositoryMapper::toResponse);
    }

    /**
     * Tracked repositories, newest registration first
     */
    @Transactional(readOnly = true)
    public List<TrackedRepository> findRecent(int limit) {
        return repositoryRepository.findAllByOrderByCreatedAtDesc(Pageable.ofSize(limit)).getContent();
    }

    @Transactional(readOnly = true)
    public TrackedRepository findById(Long id) {
        return repositoryRepository.findById(id)
                .orElseThrow(() -> new RepositoryNotFoundException(id));
    }

    // === Modification ===

    /**
     * Change the interval; the next check becomes last check (or now, if never checked) plus the new interval
     */
    @Transactional
    public RepositoryResponse updateInterval(Long id, int hours) {
        var interval = NotificationInterval.fromHours(hours);
        var repository = repositoryRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new RepositoryNotFoundException(id));

        var base = repository.getLastCheckTime() != null ? repository.getLastCheckTime() : clock.instant();
        repository.setNotificationInterval(interval);
        repository.setNextCheckTime(base.plus(interval.toDuration()));

        repository = repositoryRepository.save(repository);
        log.info("Updated repository {} interval to {}h, next check at {}",
                repository.getRepoString(), hours, repository.getNextCheckTime());

        return repositoryMapper.toResponse(repository);
    }

    /**
     * Stop tracking a repository. Its ledger entries are removed by cascade.
     */
    @Transactional
    public void delete(Long id) {
        var repository = findById(id);
        repositoryRepository.delete(repository);
        log.info("Deleted repository {} (id={})", repository.getRepoString(), id);
    }

    // === Scheduling ===

    /**
     * Repositories due at the given instant, oldest-due first
     */
    @Transactional(readOnly = true)
    public List<TrackedRepository> findDue(Instant now) {
        return repositoryRepository.findDue(now);
    }

    /**
     * Record a completed check that started at {@code checkedAt}. The next check
     * uses the interval stored now, which may have changed since the repository was loaded.
     *
     * @return false if the repository no longer exists
     */
    @Transactional
    public boolean advanceSchedule(TrackedRepository repository, Instant checkedAt) {
        var current = repositoryRepository.findByIdForUpdate(repository.getId());
        if (current.isEmpty()) {
            log.warn("Repository {} was removed during processing, schedule not advanced", repository.getRepoString());
            return false;
        }

        var next = current.get().nextCheckAfter(checkedAt);
        var updated = repositoryRepository.advanceSchedule(repository.getId(), checkedAt, next);
        if (updated == 0) {
            log.warn("Repository {} was removed during processing, schedule not advanced", repository.getRepoString());
            return false;
        }
        log.debug("Repository {} checked at {}, next check at {}", repository.getRepoString(), checkedAt, next);
        return true;
    }
}
