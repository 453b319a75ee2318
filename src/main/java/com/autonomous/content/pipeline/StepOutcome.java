package com.autonomous.content.pipeline;

/**
 * How one agent step ended after all of its attempts.
 *
 * @param attempts number of invocations made, zero when the step never started
 */
public record StepOutcome(Status status, String output, String articleId, int attempts,
                          String errorCode, String errorMessage) {

    public enum Status {
        COMPLETED,
        FAILED,
        CANCELLED,
        INTERRUPTED
    }

    static StepOutcome completed(String output, String articleId, int attempts) {
        return new StepOutcome(Status.COMPLETED, output, articleId, attempts, null, null);
    }

    static StepOutcome failed(String errorCode, String errorMessage, int attempts) {
        return new StepOutcome(Status.FAILED, null, null, attempts, errorCode, errorMessage);
    }

    static StepOutcome cancelled(int attempts) {
        return new StepOutcome(Status.CANCELLED, null, null, attempts, null, null);
    }

    static StepOutcome interrupted(int attempts) {
        return new StepOutcome(Status.INTERRUPTED, null, null, attempts, null, null);
    }
}
