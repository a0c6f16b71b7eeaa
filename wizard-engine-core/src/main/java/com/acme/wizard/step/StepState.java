package com.acme.wizard.step;

/** Position and status of a step, as exposed to callers. */
public record StepState(int index, String stepId, StepStatus status) {}
