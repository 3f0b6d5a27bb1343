package com.bank.bakeoff.service;

/**
 * Published when a bake-off needs a background run. Carries only the id: the worker
 * reads everything else from the store, so a restarted process can pick it up.
 */
public record BakeoffQueuedEvent(String bakeoffId) {
}
