package com.deepansh.assistant.resilience;

import com.deepansh.assistant.exception.ModelGatewayException;

import java.util.function.Predicate;

/**
 * Matches model failures worth another attempt: rate limits, network errors,
 * timeouts and 5xx. Referenced from application.yml as the retry and
 * circuit-breaker failure predicate.
 */
public class TransientModelFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ModelGatewayException e && e.isTransient();
    }
}
