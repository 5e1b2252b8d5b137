package com.lorastudio.model;

/**
 * Lifecycle of a batch run: IDLE → RUNNING → COMPLETED | CANCELED | FAILED.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    CANCELED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED || this == FAILED;
    }
}
