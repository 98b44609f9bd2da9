package com.deepansh.assistant.resilience;

import com.deepansh.assistant.exception.ModelUnavailableException;
import com.deepansh.assistant.llm.ModelGateway;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ModelResponse;
import com.deepansh.assistant.tool.ToolCatalog;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator around the raw gateway that adds retry + circuit breaker.
 *
 * Retry config (resilience4j.retry.instances.modelGateway):
 * - 2 attempts, i.e. one retry, with exponential backoff
 * - only transient failures are retried; auth and protocol errors fail fast
 *
 * Circuit breaker config (resilience4j.circuitbreaker.instances.modelGateway):
 * - opens after 50% transient failures in a window of 10 calls
 * - while open, calls fail immediately with a non-retryable ModelUnavailableException
 */
@Component
@Primary
@Slf4j
public class ResilientModelGateway implements ModelGateway {

    public static final String INSTANCE_NAME = "modelGateway";

    private final ModelGateway delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientModelGateway(@Qualifier("rawModelGateway") ModelGateway delegate,
                                 RetryRegistry retryRegistry,
                                 CircuitBreakerRegistry circuitBreakerRegistry) {
        this.delegate = delegate;
        this.retry = retryRegistry.retry(INSTANCE_NAME);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE_NAME);

        retry.getEventPublisher().onRetry(event -> log.warn(
                "Model call failed ({}), retry #{} in {}ms",
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis()));
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Model circuit breaker: {}", event.getStateTransition()));
    }

    @Override
    public ModelResponse complete(List<Message> history, ToolCatalog tools) {
        Supplier<ModelResponse> guarded =
                CircuitBreaker.decorateSupplier(circuitBreaker, () -> delegate.complete(history, tools));
        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (CallNotPermittedException e) {
            log.error("Model circuit breaker is OPEN, rejecting call");
            throw new ModelUnavailableException(
                    "The model service is temporarily unavailable (circuit open)", e, false);
        }
    }
}
