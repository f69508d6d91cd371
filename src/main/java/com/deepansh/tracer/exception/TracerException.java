package com.deepansh.tracer.exception;

/**
 * Base class for every failure raised by the run tracker and its collaborators.
 */
public class TracerException extends RuntimeException {

    public TracerException(String message) {
        super(message);
    }

    public TracerException(String message, Throwable cause) {
        super(message, cause);
    }
}
