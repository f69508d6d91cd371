package com.deepansh.tracer.exception;

public class RunNotFoundException extends TracerException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
