package org.nowstart.orderflow.data.dto;

public record AttemptResult(
        Outcome outcome,
        String reason
) {

    public static AttemptResult completed() {
        return new AttemptResult(Outcome.COMPLETED, null);
    }

    public static AttemptResult retry(String reason) {
        return new AttemptResult(Outcome.RETRY, reason);
    }

    public static AttemptResult failed(String reason) {
        return new AttemptResult(Outcome.FAILED, reason);
    }

    public enum Outcome {
        COMPLETED,
        RETRY,
        FAILED
    }
}
