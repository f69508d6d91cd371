package com.deepansh.tracer.exception;

public class RunPersistenceException extends TracerException {

    public RunPersistenceException(String runId, Throwable cause) {
        super("Failed to persist run tree " + runId + ": " + cause.getMessage(), cause);
    }
}
