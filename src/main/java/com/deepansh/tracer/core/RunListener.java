package com.deepansh.tracer.core;

import com.deepansh.tracer.model.Run;

/**
 * Callback for run lifecycle transitions, invoked after the tracker has
 * released its lock.
 *
 * The run passed to {@link #onRunStart} is still in flight and may gain
 * children concurrently; listeners must treat every run as read-only.
 */
public interface RunListener {

    default void onRunStart(Run run) {}

    default void onRunEnd(Run run) {}

    default void onRunError(Run run) {}
}
