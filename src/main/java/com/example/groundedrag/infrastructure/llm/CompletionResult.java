package com.example.groundedrag.infrastructure.llm;

/**
 * Outcome of one completion call. Callers pick their fallback from {@link #status()} instead of catching.
 */
public record CompletionResult(Status status, String text, String error) {

    public enum Status {
        SUCCESS,
        UNAVAILABLE,
        TRANSIENT_FAILURE,
        FAILED
    }

    public static CompletionResult success(String text) {
        return new CompletionResult(Status.SUCCESS, text, null);
    }

    public static CompletionResult unavailable(String error) {
        return new CompletionResult(Status.UNAVAILABLE, null, error);
    }

    public static CompletionResult transientFailure(String error) {
        return new CompletionResult(Status.TRANSIENT_FAILURE, null, error);
    }

    public static CompletionResult failed(String error) {
        return new CompletionResult(Status.FAILED, null, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
