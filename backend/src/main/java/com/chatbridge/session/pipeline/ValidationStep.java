package com.chatbridge.session.pipeline;

@FunctionalInterface
public interface ValidationStep<C> {

    StepResult check(C context);
}
