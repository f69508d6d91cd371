package com.deepansh.tracer.persistence;

import com.deepansh.tracer.exception.RunNotFoundException;
import com.deepansh.tracer.model.RunType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side over persisted run trees.
 */
@Service
@RequiredArgsConstructor
public class TraceQueryService {

    static final int MAX_LIMIT = 200;

    private final TracedRunRepository repository;

    public TracedRunDocument getRun(String runId) {
        return repository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    /**
     * Latest trees, newest first. Filters by name when given, else by run type when given.
     */
    public List<TracedRunDocument> findRecent(String name, RunType runType, int limit) {
        Pageable page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        if (name != null && !name.isBlank()) {
            return repository.findByNameOrderByPersistedAtDesc(name, page);
        }
        if (runType != null) {
            return repository.findByRunTypeOrderByPersistedAtDesc(runType, page);
        }
        return repository.findAllByOrderByPersistedAtDesc(page);
    }
}
