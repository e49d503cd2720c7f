package com.example.commitnotifier.exception;

import lombok.Getter;

/**
 * Exception for GitHub and Telegram communication failures.
 * <p>
 * The scheduler retries every external failure within a repository's attempt
 * budget; {@link #isRateLimited()} only changes how the failure is logged.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, Throwable cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    public boolean isNotFound() {
        return httpStatusCode != null && httpStatusCode == 404;
    }

    /**
     * GitHub answers 403 or 429 when the token's quota is exhausted
     */
    public boolean isRateLimited() {
        return httpStatusCode != null && (httpStatusCode == 429 || httpStatusCode == 403);
    }
}
