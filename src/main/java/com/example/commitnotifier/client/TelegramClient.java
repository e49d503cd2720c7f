package com.example.commitnotifier.client;

import com.example.commitnotifier.client.ClientModels.TelegramResponse;
import com.example.commitnotifier.client.ClientModels.TelegramSendMessageRequest;
import com.example.commitnotifier.config.TelegramProperties;
import com.example.commitnotifier.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the Telegram Bot API (notification sink).
 * <p>
 * Messages go to the single configured chat in HTML parse mode with link
 * previews disabled. The bot token is part of the request path and is
 * never logged.
 */
@Slf4j
@Component
public class TelegramClient {

    private static final String SERVICE_NAME = "Telegram";
    static final String PARSE_MODE = "HTML";

    private final WebClient webClient;
    private final TelegramProperties properties;

    public TelegramClient(@Qualifier("telegramWebClient") WebClient webClient, TelegramProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Send one HTML message to the configured chat
     *
     * @param text message body, already escaped for HTML
     * @throws ExternalServiceException if delivery fails or Telegram answers ok=false
     */
    @CircuitBreaker(name = "telegram", fallbackMethod = "sendMessageFallback")
    public void sendMessage(String text) {
        if (!properties.isConfigured()) {
            throw new ExternalServiceException(SERVICE_NAME, "Bot token or chat id is not configured");
        }

        var request = TelegramSendMessageRequest.builder()
                .chatId(properties.getChatId())
                .text(text)
                .parseMode(PARSE_MODE)
                .disableWebPagePreview(true)
                .build();

        TelegramResponse response;
        try {
            response = webClient.post()
                    .uri("/bot{token}/sendMessage", properties.getBotToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(TelegramResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            log.error("Telegram rejected message: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }

        if (response == null || !response.isOk()) {
            var description = response != null ? response.getDescription() : "empty response";
            log.error("Telegram returned ok=false: {}", description);
            throw new ExternalServiceException(SERVICE_NAME, "Message not accepted: " + description);
        }

        log.debug("Message sent to Telegram ({} chars)", text.length());
    }

    /**
     * Fallback when the circuit breaker is open
     */
    @SuppressWarnings("unused")
    private void sendMessageFallback(String text, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Telegram, message not sent");
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
