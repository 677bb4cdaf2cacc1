package org.nowstart.orderflow.data.exception;

import lombok.Getter;

@Getter
public class OrderProcessingException extends RuntimeException {

    private final FailureKind kind;

    public OrderProcessingException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrderProcessingException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static OrderProcessingException transientFailure(String message) {
        return new OrderProcessingException(FailureKind.TRANSIENT, message);
    }

    public static OrderProcessingException permanent(String message) {
        return new OrderProcessingException(FailureKind.PERMANENT, message);
    }

    public enum FailureKind {
        TRANSIENT,
        PERMANENT
    }
}
