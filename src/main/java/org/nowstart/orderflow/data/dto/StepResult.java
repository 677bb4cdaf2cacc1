package org.nowstart.orderflow.data.dto;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.nowstart.orderflow.data.exception.OrderPersistenceException;
import org.nowstart.orderflow.data.exception.OrderProcessingException;

/**
 * Outcome of one step of an order attempt.
 */
public sealed interface StepResult<T> permits StepResult.Ok, StepResult.Retryable, StepResult.Fatal {

    record Ok<T>(T value) implements StepResult<T> {
    }

    record Retryable<T>(String reason, Throwable cause) implements StepResult<T> {
    }

    record Fatal<T>(String reason, Throwable cause) implements StepResult<T> {
    }

    static <T> StepResult<T> capture(Supplier<T> step) {
        try {
            return new Ok<>(step.get());
        } catch (RuntimeException e) {
            return fromFailure(unwrap(e));
        }
    }

    static <T> StepResult<T> fromFailure(Throwable failure) {
        if (failure instanceof OrderProcessingException processingException) {
            return processingException.getKind() == OrderProcessingException.FailureKind.TRANSIENT
                    ? new Retryable<>(processingException.getMessage(), processingException)
                    : new Fatal<>(processingException.getMessage(), processingException);
        }
        if (failure instanceof OrderPersistenceException persistenceException) {
            return new Retryable<>(persistenceException.getMessage(), persistenceException);
        }
        String reason = failure.getMessage() == null || failure.getMessage().isBlank()
                ? failure.getClass().getSimpleName()
                : failure.getMessage();
        return new Fatal<>(reason, failure);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
