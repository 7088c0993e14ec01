package com.chatbridge.session.pipeline;

import java.util.List;

/**
 * Ordered validation steps. The first failing step stops the run; steps after
 * it, including any that record state, never execute.
 */
public final class ValidationPipeline<C> {

    private final List<ValidationStep<C>> steps;

    private ValidationPipeline(List<ValidationStep<C>> steps) {
        this.steps = steps;
    }

    @SafeVarargs
    public static <C> ValidationPipeline<C> of(ValidationStep<C>... steps) {
        return new ValidationPipeline<>(List.of(steps));
    }

    public StepResult evaluate(C context) {
        for (ValidationStep<C> step : steps) {
            StepResult result = step.check(context);
            if (!result.isOk()) {
                return result;
            }
        }
        return StepResult.ok();
    }

    /**
     * @throws com.chatbridge.exception.ChatException of the first failing step
     */
    public void run(C context) {
        evaluate(context).orThrow();
    }
}
