package org.nowstart.orderflow.data.type;

public enum OrderType {
    MARKET(true),
    LIMIT(false),
    SNIPER(false);

    private final boolean executable;

    OrderType(boolean executable) {
        this.executable = executable;
    }

    public boolean isExecutable() {
        return executable;
    }
}
