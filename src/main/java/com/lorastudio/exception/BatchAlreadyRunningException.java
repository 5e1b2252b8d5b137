package com.lorastudio.exception;

public class BatchAlreadyRunningException extends IllegalStateException {

    public BatchAlreadyRunningException() {
        super("A caption batch is already running. Stop it or wait for it to finish.");
    }
}
