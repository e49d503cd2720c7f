package com.example.commitnotifier.client;

import com.example.commitnotifier.client.ClientModels.GitHubCommit;
import com.example.commitnotifier.client.ClientModels.RateLimitResponse;
import com.example.commitnotifier.client.ClientModels.RateLimitStatus;
import com.example.commitnotifier.config.GitHubProperties;
import com.example.commitnotifier.domain.RepositoryCoordinates;
import com.example.commitnotifier.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Client for the GitHub REST API (commit source).
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a GitHub outage fails fast
 * - WebClient with per-request timeout
 * <p>
 * Retries are not done here: the notification scheduler retries the whole
 * per-repository unit.
 */
@Slf4j
@Component
public class GitHubClient {

    private static final String SERVICE_NAME = "GitHub";
    private static final int MAX_PER_PAGE = 100;

    private static final ParameterizedTypeReference<List<GitHubCommit>> COMMIT_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final GitHubProperties properties;

    public GitHubClient(@Qualifier("gitHubWebClient") WebClient webClient, GitHubProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Fetch the most recent commits of a repository, newest first
     *
     * @param coordinates repository and optional branch
     * @param since       only commits after this instant; null for no lower bound
     * @param maxCount    maximum number of commits (capped at 100, one page)
     * @return commits in GitHub order, never null
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "github", fallbackMethod = "fetchCommitsFallback")
    public List<GitHubCommit> fetchCommits(RepositoryCoordinates coordinates, Instant since, int maxCount) {
        var perPage = Math.max(1, Math.min(maxCount, MAX_PER_PAGE));
        log.debug("Fetching up to {} commits from {} since {}", perPage, coordinates, since);

        try {
            var commits = webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/repos/{owner}/{repo}/commits")
                                .queryParam("per_page", perPage);
                        if (coordinates.hasBranch()) {
                            uriBuilder.queryParam("sha", coordinates.getBranch());
                        }
                        if (since != null) {
                            uriBuilder.queryParam("since", since.toString());
                        }
                        return uriBuilder.build(coordinates.getOwner(), coordinates.getRepo());
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(COMMIT_LIST)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            var result = commits != null ? commits : List.<GitHubCommit>of();
            log.debug("Found {} commits in {}", result.size(), coordinates);
            return result;
        } catch (ExternalServiceException e) {
            if (e.isRateLimited()) {
                log.warn("GitHub rate limit hit while fetching {}: {}", coordinates, e.getMessage());
            }
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch commits from {}: {}", coordinates, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback when the circuit breaker is open
     */
    @SuppressWarnings("unused")
    private List<GitHubCommit> fetchCommitsFallback(RepositoryCoordinates coordinates, Instant since, int maxCount,
                                                    CallNotPermittedException e) {
        log.warn("Circuit breaker open for GitHub, repository: {}", coordinates);
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    /**
     * Current core API quota of the configured token
     */
    @CircuitBreaker(name = "github")
    public RateLimitStatus getRateLimit() {
        log.debug("Checking GitHub rate limit");

        try {
            var response = webClient.get()
                    .uri("/rate_limit")
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(RateLimitResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            if (response == null || response.getRate() == null) {
                throw new ExternalServiceException(SERVICE_NAME, "Empty rate limit response");
            }

            var rate = response.getRate();
            return RateLimitStatus.builder()
                    .limit(rate.getLimit())
                    .remaining(rate.getRemaining())
                    .resetTime(Instant.ofEpochSecond(rate.getReset()))
                    .build();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to check GitHub rate limit: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }
}
