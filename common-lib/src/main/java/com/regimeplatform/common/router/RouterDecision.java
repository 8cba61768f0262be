package com.regimeplatform.common.router;

/**
 * Outcome of one routing step.
 *
 * @param model    model selected for this tick
 * @param switched true when this tick moved away from the previous model
 * @param frozen   true when a recent change-point held the current model
 */
public record RouterDecision(String model, boolean switched, boolean frozen) {}
