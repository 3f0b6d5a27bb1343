package com.bank.bakeoff.engine.trainer;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation for long fits. Training loops call {@link #checkInterrupted()}
 * once per round, tree, epoch or node so a timed-out candidate releases its worker thread.
 */
public final class TrainingBudget {

    private TrainingBudget() {}

    public static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Training interrupted");
        }
    }
}
