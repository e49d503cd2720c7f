package com.example.commitnotifier.client;

import com.example.commitnotifier.config.GitHubProperties;
import com.example.commitnotifier.domain.RepositoryCoordinates;
import com.example.commitnotifier.exception.ExternalServiceException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GitHubClient Tests")
class GitHubClientTest {

    private static final String COMMITS_JSON = """
            [
              {
                "sha": "0123456789abcdef0123456789abcdef01234567",
                "html_url": "https://github.com/acme/api/commit/0123456",
                "commit": {
                  "message": "Add login endpoint\\n\\nWith rate limiting",
                  "author": {"name": "Jane Doe", "email": "jane@example.com", "date": "2024-05-01T08:00:00Z"}
                },
                "author": {"login": "jane"},
                "parents": []
              }
            ]
            """;

    private MockWebServer server;
    private GitHubClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        var properties = new GitHubProperties();
        properties.setToken("gh-token");
        properties.setTimeoutSeconds(5);

        var webClient = WebClient.builder()
                .baseUrl(server.url("/").toString())
                .build();
        client = new GitHubClient(webClient, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .setBody(body);
    }

    @Nested
    @DisplayName("fetchCommits Tests")
    class FetchCommitsTests {

        @Test
        @DisplayName("Should request the branch since the last check and map the response")
        void shouldFetchCommits() throws Exception {
            // Given
            server.enqueue(json(200, COMMITS_JSON));

            // When
            var commits = client.fetchCommits(new RepositoryCoordinates("acme", "api", "develop"),
                    Instant.parse("2024-05-01T07:00:00Z"), 50);

            // Then
            var request = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request.getMethod()).isEqualTo("GET");
            assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/repos/acme/api/commits");
            assertThat(request.getRequestUrl().queryParameter("per_page")).isEqualTo("50");
            assertThat(request.getRequestUrl().queryParameter("sha")).isEqualTo("develop");
            assertThat(request.getRequestUrl().queryParameter("since")).isEqualTo("2024-05-01T07:00:00Z");

            assertThat(commits).hasSize(1);
            var commit = commits.get(0);
            assertThat(commit.shortSha()).isEqualTo("0123456");
            assertThat(commit.message()).isEqualTo("Add login endpoint\n\nWith rate limiting");
            assertThat(commit.authorName()).isEqualTo("Jane Doe");
            assertThat(commit.authorDate()).isEqualTo("2024-05-01T08:00:00Z");
            assertThat(commit.getHtmlUrl()).isEqualTo("https://github.com/acme/api/commit/0123456");
        }

        @Test
        @DisplayName("Should omit branch and since when not given, and cap the page size")
        void shouldOmitOptionalParameters() throws Exception {
            // Given
            server.enqueue(json(200, "[]"));

            // When
            var commits = client.fetchCommits(new RepositoryCoordinates("acme", "api", null), null, 500);

            // Then
            var request = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request.getRequestUrl().queryParameter("per_page")).isEqualTo("100");
            assertThat(request.getRequestUrl().queryParameter("sha")).isNull();
            assertThat(request.getRequestUrl().queryParameter("since")).isNull();
            assertThat(commits).isEmpty();
        }

        @Test
        @DisplayName("Should raise not-found for an unknown repository")
        void shouldRaiseNotFound() {
            server.enqueue(json(404, "{\"message\":\"Not Found\"}"));

            assertThatThrownBy(() -> client.fetchCommits(new RepositoryCoordinates("acme", "gone", null), null, 10))
                    .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                        assertThat(e.isNotFound()).isTrue();
                        assertThat(e.getHttpStatusCode()).isEqualTo(404);
                    });
        }

        @Test
        @DisplayName("Should flag rate limiting")
        void shouldFlagRateLimit() {
            server.enqueue(json(429, "{\"message\":\"API rate limit exceeded\"}"));

            assertThatThrownBy(() -> client.fetchCommits(new RepositoryCoordinates("acme", "api", null), null, 10))
                    .isInstanceOfSatisfying(ExternalServiceException.class,
                            e -> assertThat(e.isRateLimited()).isTrue());
        }

        @Test
        @DisplayName("Should wrap malformed bodies")
        void shouldWrapMalformedBody() {
            server.enqueue(json(200, "{not json"));

            assertThatThrownBy(() -> client.fetchCommits(new RepositoryCoordinates("acme", "api", null), null, 10))
                    .isInstanceOf(ExternalServiceException.class)
                    .hasMessageStartingWith("[GitHub]");
        }
    }

    @Nested
    @DisplayName("getRateLimit Tests")
    class RateLimitTests {

        @Test
        @DisplayName("Should map the core quota")
        void shouldMapQuota() throws Exception {
            server.enqueue(json(200, """
                    {"resources": {}, "rate": {"limit": 5000, "remaining": 4987, "reset": 1714560000, "used": 13}}
                    """));

            var status = client.getRateLimit();

            assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/rate_limit");
            assertThat(status.getLimit()).isEqualTo(5000);
            assertThat(status.getRemaining()).isEqualTo(4987);
            assertThat(status.getResetTime()).isEqualTo(Instant.ofEpochSecond(1714560000L));
        }

        @Test
        @DisplayName("Should fail on server error")
        void shouldFailOnServerError() {
            server.enqueue(json(500, "{}"));

            assertThatThrownBy(() -> client.getRateLimit())
                    .isInstanceOfSatisfying(ExternalServiceException.class,
                            e -> assertThat(e.getHttpStatusCode()).isEqualTo(500));
        }
    }
}
