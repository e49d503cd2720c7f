package com.example.commitnotifier.exception;

/**
 * Exception for notification endpoints invoked without GitHub or Telegram credentials
 */
public class NotificationConfigurationException extends RuntimeException {

    public NotificationConfigurationException(String message) {
        super(message);
    }
}
