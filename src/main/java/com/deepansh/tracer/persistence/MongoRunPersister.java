package com.deepansh.tracer.persistence;

import com.deepansh.tracer.exception.RunPersistenceException;
import com.deepansh.tracer.model.Run;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Stores completed run trees in MongoDB.
 *
 * Runs @Async on the persistence pool; the tracker gets the future back
 * immediately. Mapping and storage failures complete the future exceptionally and are
 * not retried here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoRunPersister implements RunPersister {

    private final TracedRunRepository repository;

    @Override
    @Async("persistenceTaskExecutor")
    public CompletableFuture<Void> persistRun(Run root) {
        try {
            TracedRunDocument saved = repository.save(TracedRunDocument.from(root));
            log.info("Run tree persisted [id={}, name={}, type={}, runs={}]",
                    saved.getId(), saved.getName(), saved.getRunType(), saved.getRunCount());
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Failed to persist run tree [id={}]", root.getId(), e);
            return CompletableFuture.failedFuture(new RunPersistenceException(root.getId(), e));
        }
    }
}
