package com.deepansh.tracer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of an llm or chat-model run: one list of generations per prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmResult {

    @Builder.Default
    private List<List<Generation>> generations = new ArrayList<>();

    /** Token usage and other provider output; optional */
    private Map<String, Object> llmOutput;

    public static LlmResult of(List<List<Generation>> generations) {
        return LlmResult.builder().generations(generations).build();
    }
}
