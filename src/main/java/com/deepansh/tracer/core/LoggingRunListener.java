package com.deepansh.tracer.core;

import com.deepansh.tracer.model.Run;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Writes one log line per run transition, e.g.
 * {@code [chain/start] [1:chain:AgentExecutor] Entering Chain run with input: {...}}
 */
@Slf4j
public class LoggingRunListener implements RunListener {

    private final ObjectMapper objectMapper;
    private final int maxPayloadChars;

    public LoggingRunListener(ObjectMapper objectMapper, int maxPayloadChars) {
        this.objectMapper = objectMapper;
        this.maxPayloadChars = maxPayloadChars;
    }

    @Override
    public void onRunStart(Run run) {
        log.info("[{}/start] [{}] Entering {} run with input: {}",
                run.getRunType(), breadcrumb(run), label(run), render(run.getInputs()));
    }

    @Override
    public void onRunEnd(Run run) {
        log.info("[{}/end] [{}] [{}ms] Exiting {} run with output: {}",
                run.getRunType(), breadcrumb(run), elapsed(run), label(run), render(run.getOutputs()));
    }

    @Override
    public void onRunError(Run run) {
        log.info("[{}/error] [{}] [{}ms] {} run errored with error: {}",
                run.getRunType(), breadcrumb(run), elapsed(run), label(run), run.getError());
    }

    String breadcrumb(Run run) {
        return run.getExecutionOrder() + ":" + run.getRunType() + ":" + run.getName();
    }

    String render(Map<String, Object> payload) {
        if (payload == null) return "{}";
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            json = payload.toString();
        }
        return json.length() <= maxPayloadChars ? json : json.substring(0, maxPayloadChars) + "...[truncated]";
    }

    private static String label(Run run) {
        return switch (run.getRunType()) {
            case llm -> "LLM";
            case chain -> "Chain";
            case tool -> "Tool";
        };
    }

    private static long elapsed(Run run) {
        return run.getEndTime() == null ? 0 : run.getEndTime() - run.getStartTime();
    }
}
