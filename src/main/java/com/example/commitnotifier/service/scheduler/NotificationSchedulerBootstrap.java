package com.example.commitnotifier.service.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the notification scheduler once the application is ready and
 * drains it on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationSchedulerBootstrap {

    private final NotificationScheduler scheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            scheduler.start();
        } catch (Exception e) {
            log.error("Failed to start notification scheduler: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void onShutdown() {
        scheduler.stop();
    }
}
