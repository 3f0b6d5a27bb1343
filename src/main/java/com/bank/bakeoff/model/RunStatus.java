package com.bank.bakeoff.model;

public enum RunStatus {
    CREATED,
    SCORING,
    SCORED,
    FAILED
}
