package com.deepansh.tracer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One traced unit of work and its position in the execution tree.
 *
 * A run is mutated in place while in flight (children attach to it as they
 * complete) and is frozen once it is attached to its parent or handed to the
 * persister as a root.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Run {

    private String id;
    private String name;
    private RunType runType;
    private Serialized serialized;

    private Map<String, Object> inputs;

    /** Null until the run ends successfully */
    private Map<String, Object> outputs;

    /** Message of the failure when the run ended through an error notification */
    private String error;

    /** Epoch millis */
    private long startTime;
    private Long endTime;

    private int executionOrder;

    /** Highest execution order within this run's subtree */
    private int childExecutionOrder;

    /** Null for a root run */
    private String parentRunId;

    /** Completed children, in completion order */
    @Builder.Default
    private List<Run> childRuns = new ArrayList<>();

    /** Invocation parameters; llm runs only */
    private Map<String, Object> extra;

    @JsonIgnore
    public boolean isRoot() {
        return parentRunId == null;
    }
}
