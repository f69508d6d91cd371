package com.deepansh.tracer.exception;

import com.deepansh.tracer.model.RunType;
import lombok.Getter;

/**
 * An end or error notification named a run that is not in flight,
 * or that is in flight under a different run type.
 */
@Getter
public class NoRunToEndException extends TracerException {

    private final RunType expectedType;
    private final String runId;

    public NoRunToEndException(RunType expectedType, String runId) {
        super("No " + label(expectedType) + " run to end");
        this.expectedType = expectedType;
        this.runId = runId;
    }

    private static String label(RunType type) {
        return type == RunType.llm ? "LLM" : type.name();
    }
}
