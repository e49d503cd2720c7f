package com.example.commitnotifier.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the GitHub and Telegram APIs.
 * <p>
 * Each API gets its own instance with timeouts, logging and error logging.
 * Credentials are applied per client: the GitHub token as a default header,
 * the Telegram bot token as part of the request path.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    /**
     * WebClient for GitHub REST API calls
     */
    @Bean(name = "gitHubWebClient")
    public WebClient gitHubWebClient(WebClient.Builder builder, GitHubProperties properties) {
        var clientBuilder = createWebClientBuilder(builder, properties.getApiBaseUrl(), properties.getTimeoutSeconds(), "GitHub")
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28");

        if (properties.hasToken()) {
            clientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
        }

        return clientBuilder.build();
    }

    /**
     * WebClient for Telegram Bot API calls
     */
    @Bean(name = "telegramWebClient")
    public WebClient telegramWebClient(WebClient.Builder builder, TelegramProperties properties) {
        return createWebClientBuilder(builder, properties.getApiBaseUrl(), properties.getTimeoutSeconds(), "Telegram")
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private WebClient.Builder createWebClientBuilder(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, "commit-notifier")
                .filter(logRequest(serviceName))
                .filter(logErrors(serviceName));
    }

    /**
     * Log outgoing requests. Telegram URLs carry the bot token, so only the path template is logged.
     */
    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), redact(clientRequest.url().getPath()));
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logErrors(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }

    static String redact(String path) {
        if (path == null) {
            return "";
        }
        return path.replaceAll("/bot[^/]+/", "/bot***/");
    }
}
