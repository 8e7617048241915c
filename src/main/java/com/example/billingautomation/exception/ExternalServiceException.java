package com.example.billingautomation.exception;

import lombok.Getter;

/**
 * A call to the property management API failed.
 * <p>
 * Carries the HTTP status and body when the API answered, and nothing when the
 * call never completed (timeout, connection refused, open circuit). Only the
 * latter, 5xx, 408 and 429 are worth retrying; the Resilience4j retry reads this
 * through {@link RetryableFailurePredicate}.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, cause.getMessage(), cause);
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    /**
     * The API answered with a 4xx other than 408 or 429, e.g. an unknown tenant or a rejected invoice
     */
    public boolean isRejected() {
        return httpStatusCode != null && httpStatusCode >= 400 && httpStatusCode < 500
                && httpStatusCode != 408 && httpStatusCode != 429;
    }

    public boolean isRetryable() {
        return !isRejected();
    }
}
