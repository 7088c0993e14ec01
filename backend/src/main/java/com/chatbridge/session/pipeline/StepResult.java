package com.chatbridge.session.pipeline;

import com.chatbridge.exception.ChatException;

/**
 * Outcome of one validation step: success, or the rejection to report.
 */
public final class StepResult {

    private static final StepResult OK = new StepResult(null);

    private final ChatException failure;

    private StepResult(ChatException failure) {
        this.failure = failure;
    }

    public static StepResult ok() {
        return OK;
    }

    public static StepResult fail(ChatException failure) {
        return new StepResult(failure);
    }

    public boolean isOk() {
        return failure == null;
    }

    public ChatException getFailure() {
        return failure;
    }

    public void orThrow() {
        if (failure != null) {
            throw failure;
        }
    }
}
