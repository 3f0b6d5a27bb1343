package com.bank.bakeoff.model;

/**
 * BATCH runs every candidate in the background worker; INCREMENTAL leaves
 * train-candidate and finalize calls to the caller.
 */
public enum ExecutionMode {
    BATCH,
    INCREMENTAL
}
