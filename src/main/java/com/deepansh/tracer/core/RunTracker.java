package com.deepansh.tracer.core;

import com.deepansh.tracer.exception.MissingRunException;
import com.deepansh.tracer.exception.NoRunToEndException;
import com.deepansh.tracer.model.ChatMessage;
import com.deepansh.tracer.model.LlmResult;
import com.deepansh.tracer.model.Run;
import com.deepansh.tracer.model.RunType;
import com.deepansh.tracer.model.Serialized;
import com.deepansh.tracer.model.StoredMessage;
import com.deepansh.tracer.persistence.RunPersister;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Rebuilds execution trees from flat start/end notifications.
 *
 * In-flight runs live in a registry keyed by run id. A run only knows its
 * parent's id; it is appended to the parent's child runs when it completes,
 * and a root run is handed to the {@link RunPersister} once it completes.
 *
 * Per call flow:
 * 1. start: stamp start time, take the next execution order, register
 * 2. end/error: validate id and run type, stamp end time, deregister
 * 3. attach to the in-flight parent, or dispatch the finished tree
 *
 * Registry, execution counter and parent attachment are guarded by one lock.
 * Persistence and listener callbacks run after the lock is released; listener
 * failures are logged, never rethrown.
 */
@Slf4j
public class RunTracker {

    private final RunPersister persister;
    private final List<RunListener> listeners;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Run> runMap = new HashMap<>();
    private int executionOrder;

    public RunTracker(RunPersister persister, List<RunListener> listeners, Clock clock) {
        this.persister = persister;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public RunTracker(RunPersister persister, Clock clock) {
        this(persister, List.of(), clock);
    }

    // ─── LLM ─────────────────────────────────────────────────────────────────

    public void handleLlmStart(Serialized serialized, List<String> prompts, String runId) {
        handleLlmStart(serialized, prompts, runId, null, null);
    }

    public void handleLlmStart(Serialized serialized, List<String> prompts, String runId, String parentRunId) {
        handleLlmStart(serialized, prompts, runId, parentRunId, null);
    }

    public void handleLlmStart(Serialized serialized, List<String> prompts, String runId,
                               String parentRunId, Map<String, Object> extra) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("prompts", new ArrayList<>(prompts));
        startTrace(newRun(serialized, RunType.llm, inputs, runId, parentRunId, extra));
    }

    public void handleChatModelStart(Serialized serialized, List<List<ChatMessage>> messages, String runId) {
        handleChatModelStart(serialized, messages, runId, null, null);
    }

    public void handleChatModelStart(Serialized serialized, List<List<ChatMessage>> messages,
                                     String runId, String parentRunId) {
        handleChatModelStart(serialized, messages, runId, parentRunId, null);
    }

    /**
     * Chat-model invocations are recorded as llm runs and end through {@link #handleLlmEnd}.
     */
    public void handleChatModelStart(Serialized serialized, List<List<ChatMessage>> messages,
                                     String runId, String parentRunId, Map<String, Object> extra) {
        List<List<StoredMessage>> stored = messages.stream()
                .map(conversation -> conversation.stream().map(ChatMessage::toStored).toList())
                .toList();
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("messages", stored);
        startTrace(newRun(serialized, RunType.llm, inputs, runId, parentRunId, extra));
    }

    public CompletableFuture<Void> handleLlmEnd(LlmResult output, String runId) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("generations", output.getGenerations());
        if (output.getLlmOutput() != null) {
            outputs.put("llm_output", output.getLlmOutput());
        }
        return endTrace(RunType.llm, runId, run -> run.setOutputs(outputs), false);
    }

    public CompletableFuture<Void> handleLlmError(Throwable error, String runId) {
        return endTrace(RunType.llm, runId, run -> run.setError(describe(error)), true);
    }

    // ─── Chain ───────────────────────────────────────────────────────────────

    public void handleChainStart(Serialized serialized, Map<String, Object> inputs, String runId) {
        handleChainStart(serialized, inputs, runId, null);
    }

    public void handleChainStart(Serialized serialized, Map<String, Object> inputs,
                                 String runId, String parentRunId) {
        startTrace(newRun(serialized, RunType.chain, new LinkedHashMap<>(inputs), runId, parentRunId, null));
    }

    public CompletableFuture<Void> handleChainEnd(Map<String, Object> outputs, String runId) {
        Map<String, Object> copy = new LinkedHashMap<>(outputs);
        return endTrace(RunType.chain, runId, run -> run.setOutputs(copy), false);
    }

    public CompletableFuture<Void> handleChainError(Throwable error, String runId) {
        return endTrace(RunType.chain, runId, run -> run.setError(describe(error)), true);
    }

    // ─── Tool ────────────────────────────────────────────────────────────────

    public void handleToolStart(Serialized serialized, String input, String runId) {
        handleToolStart(serialized, input, runId, null);
    }

    public void handleToolStart(Serialized serialized, String input, String runId, String parentRunId) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("input", input);
        startTrace(newRun(serialized, RunType.tool, inputs, runId, parentRunId, null));
    }

    public CompletableFuture<Void> handleToolEnd(String output, String runId) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("output", output);
        return endTrace(RunType.tool, runId, run -> run.setOutputs(outputs), false);
    }

    public CompletableFuture<Void> handleToolError(Throwable error, String runId) {
        return endTrace(RunType.tool, runId, run -> run.setError(describe(error)), true);
    }

    // ─── Registry ────────────────────────────────────────────────────────────

    public Set<String> inFlightRunIds() {
        lock.lock();
        try {
            return Set.copyOf(runMap.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return runMap.size();
        } finally {
            lock.unlock();
        }
    }

    private Run newRun(Serialized serialized, RunType runType, Map<String, Object> inputs,
                       String runId, String parentRunId, Map<String, Object> extra) {
        return Run.builder()
                .id(runId)
                .name(serialized.name())
                .runType(runType)
                .serialized(serialized)
                .inputs(inputs)
                .startTime(clock.millis())
                .parentRunId(parentRunId)
                .childRuns(new ArrayList<>())
                .extra(extra)
                .build();
    }

    private void startTrace(Run run) {
        lock.lock();
        try {
            if (runMap.containsKey(run.getId())) {
                log.warn("Rejected start of run already in flight [id={}, type={}]", run.getId(), run.getRunType());
                throw MissingRunException.alreadyStarted(run.getId());
            }
            int order = ++executionOrder;
            run.setExecutionOrder(order);
            run.setChildExecutionOrder(order);
            runMap.put(run.getId(), run);
        } finally {
            lock.unlock();
        }

        log.debug("Run started [id={}, type={}, name={}, order={}, parent={}]",
                run.getId(), run.getRunType(), run.getName(), run.getExecutionOrder(), run.getParentRunId());

        notifyListeners(run, RunListener::onRunStart);
    }

    /**
     * Closes an in-flight run. Every check happens before the first mutation,
     * so a rejected notification leaves the registry and the parent untouched.
     */
    private CompletableFuture<Void> endTrace(RunType expectedType, String runId,
                                             Consumer<Run> completion, boolean errored) {
        Run run;
        lock.lock();
        try {
            run = runMap.get(runId);
            if (run == null || run.getRunType() != expectedType) {
                log.warn("Rejected end of {} run not in flight [id={}]", expectedType, runId);
                throw new NoRunToEndException(expectedType, runId);
            }

            Run parent = null;
            if (!run.isRoot()) {
                parent = runMap.get(run.getParentRunId());
                if (parent == null) {
                    log.warn("Rejected end of run whose parent is not in flight [id={}, parent={}]",
                            runId, run.getParentRunId());
                    throw MissingRunException.parentNotFound(run.getParentRunId(), runId);
                }
            }

            run.setEndTime(clock.millis());
            completion.accept(run);
            runMap.remove(runId);

            if (parent != null) {
                parent.getChildRuns().add(run);
                parent.setChildExecutionOrder(
                        Math.max(parent.getChildExecutionOrder(), run.getChildExecutionOrder()));
            }
        } finally {
            lock.unlock();
        }

        log.debug("Run {} [id={}, type={}, name={}]",
                errored ? "errored" : "ended", runId, run.getRunType(), run.getName());

        CompletableFuture<Void> dispatched = run.isRoot()
                ? dispatch(run)
                : CompletableFuture.completedFuture(null);

        notifyListeners(run, errored ? RunListener::onRunError : RunListener::onRunEnd);
        return dispatched;
    }

    /**
     * The notification has already taken effect; a failing listener is logged and
     * does not change the outcome of the call or stop later listeners.
     */
    private void notifyListeners(Run run, BiConsumer<RunListener, Run> callback) {
        for (RunListener listener : listeners) {
            try {
                callback.accept(listener, run);
            } catch (RuntimeException e) {
                log.error("Run listener {} failed [id={}, type={}]",
                        listener.getClass().getSimpleName(), run.getId(), run.getRunType(), e);
            }
        }
    }

    private CompletableFuture<Void> dispatch(Run root) {
        log.info("Dispatching completed run tree [id={}, name={}, runs={}, lastOrder={}]",
                root.getId(), root.getName(), countRuns(root), root.getChildExecutionOrder());
        return persister.persistRun(root);
    }

    private static int countRuns(Run run) {
        int count = 1;
        for (Run child : run.getChildRuns()) {
            count += countRuns(child);
        }
        return count;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
