package com.deepansh.tracer.persistence;

import com.deepansh.tracer.model.Run;

import java.util.concurrent.CompletableFuture;

/**
 * Sink for completed execution trees.
 */
public interface RunPersister {

    /**
     * Durably record a completed root run together with all of its nested child runs.
     *
     * @param root  run without a parent whose whole subtree has completed
     * @return a future that completes when the tree is stored, or completes
     *         exceptionally with the sink's failure
     */
    CompletableFuture<Void> persistRun(Run root);
}
