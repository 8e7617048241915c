package com.example.billingautomation.exception;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code propertyService} Resilience4j instance.
 * A rejected request is not retried; every other failure is.
 */
public class RetryableFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException) {
            return ((ExternalServiceException) throwable).isRetryable();
        }
        return true;
    }
}
