package com.deepansh.tracer.api;

import com.deepansh.tracer.core.RunTracker;
import com.deepansh.tracer.model.RunType;
import com.deepansh.tracer.persistence.TraceQueryService;
import com.deepansh.tracer.persistence.TracedRunDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * REST endpoints for completed run trees and the live registry.
 *
 * GET /api/v1/runs/{runId}              : one stored root tree
 * GET /api/v1/runs?name=&type=&limit=   : latest stored trees, newest first
 * GET /api/v1/runs/in-flight            : runs started but not yet ended
 */
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class TraceController {

    private final TraceQueryService traceQueryService;
    private final RunTracker runTracker;

    @GetMapping("/in-flight")
    public ResponseEntity<Map<String, Object>> getInFlight() {
        return ResponseEntity.ok(Map.of(
                "count", runTracker.inFlightCount(),
                "run_ids", new TreeSet<>(runTracker.inFlightRunIds())
        ));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<TracedRunDocument> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(traceQueryService.getRun(runId));
    }

    @GetMapping
    public ResponseEntity<List<TracedRunDocument>> getRuns(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) RunType type,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(traceQueryService.findRecent(name, type, limit));
    }
}
