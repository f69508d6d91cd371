package com.deepansh.tracer.api;

import com.deepansh.tracer.core.RunTracker;
import com.deepansh.tracer.exception.GlobalExceptionHandler;
import com.deepansh.tracer.exception.RunNotFoundException;
import com.deepansh.tracer.model.Run;
import com.deepansh.tracer.model.RunType;
import com.deepansh.tracer.model.Serialized;
import com.deepansh.tracer.persistence.TraceQueryService;
import com.deepansh.tracer.persistence.TracedRunDocument;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.contains;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TraceControllerTest {

    private TraceQueryService queryService;
    private RunTracker tracker;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryService = mock(TraceQueryService.class);
        tracker = new RunTracker(run -> CompletableFuture.completedFuture(null), Clock.systemUTC());
        mockMvc = MockMvcBuilders.standaloneSetup(new TraceController(queryService, tracker))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                        .serializationInclusion(JsonInclude.Include.NON_NULL)
                        .build()))
                .build();
    }

    @Test
    void getRun_returnsStoredTree() throws Exception {
        Run root = Run.builder().id("chain-1").name("AgentExecutor").runType(RunType.chain)
                .serialized(Serialized.of("AgentExecutor")).executionOrder(1).childExecutionOrder(1).build();
        when(queryService.getRun("chain-1")).thenReturn(TracedRunDocument.from(root));

        mockMvc.perform(get("/api/v1/runs/chain-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("chain-1"))
                .andExpect(jsonPath("$.run_type").value("chain"))
                .andExpect(jsonPath("$.child_execution_order").value(1))
                .andExpect(jsonPath("$.run.name").value("AgentExecutor"))
                .andExpect(jsonPath("$.run.execution_order").value(1))
                .andExpect(jsonPath("$.run.child_runs").isEmpty())
                .andExpect(jsonPath("$.runType").doesNotExist());
    }

    @Test
    void getRun_missing_returns404() throws Exception {
        when(queryService.getRun("ghost")).thenThrow(new RunNotFoundException("ghost"));

        mockMvc.perform(get("/api/v1/runs/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Run not found: ghost"));
    }

    @Test
    void getRuns_passesFilters() throws Exception {
        when(queryService.findRecent(null, RunType.tool, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/runs").param("type", "tool").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(queryService).findRecent(null, RunType.tool, 5);
    }

    @Test
    void getInFlight_listsRegistry() throws Exception {
        tracker.handleChainStart(Serialized.of("chain"), Map.of(), "b-run");
        tracker.handleToolStart(Serialized.of("tool"), "x", "a-run", "b-run");

        mockMvc.perform(get("/api/v1/runs/in-flight"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.run_ids", contains("a-run", "b-run")));
    }
}
