package org.nowstart.orderflow.data.exception;

import lombok.Getter;

@Getter
public class OrderPersistenceException extends RuntimeException {

    private final Store store;

    public OrderPersistenceException(Store store, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
    }

    public enum Store {
        EPHEMERAL,
        DURABLE
    }
}
