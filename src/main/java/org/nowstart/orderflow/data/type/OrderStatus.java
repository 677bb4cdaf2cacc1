package org.nowstart.orderflow.data.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OrderStatus {
    PENDING(0, false),
    ROUTING(1, false),
    BUILDING(2, false),
    SUBMITTED(3, false),
    CONFIRMED(4, true),
    FAILED(4, true),
    CANCELLED(4, true);

    private final int stage;
    private final boolean terminal;

    OrderStatus(int stage, boolean terminal) {
        this.stage = stage;
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(OrderStatus next) {
        if (terminal || next == null) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return next.stage == stage + 1;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OrderStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
