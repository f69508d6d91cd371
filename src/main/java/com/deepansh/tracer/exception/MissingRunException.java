package com.deepansh.tracer.exception;

import lombok.Getter;

/**
 * The registry does not hold the run a notification depends on: a completing
 * child names a parent that is no longer (or never was) in flight, or a start
 * reuses the id of a run that is still in flight.
 */
@Getter
public class MissingRunException extends TracerException {

    private final String runId;

    public MissingRunException(String message, String runId) {
        super(message);
        this.runId = runId;
    }

    public static MissingRunException parentNotFound(String parentRunId, String childRunId) {
        return new MissingRunException(
                "Parent run " + parentRunId + " of run " + childRunId + " is not in flight", parentRunId);
    }

    public static MissingRunException alreadyStarted(String runId) {
        return new MissingRunException("Run " + runId + " is already in flight", runId);
    }
}
