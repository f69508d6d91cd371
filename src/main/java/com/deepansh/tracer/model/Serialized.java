package com.deepansh.tracer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptor of the component being run (model, chain, tool).
 * Stored verbatim on the run; only the identifier path is ever read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Serialized {

    @Builder.Default
    private int lc = 1;

    /** constructor | secret | not_implemented */
    @Builder.Default
    private String type = "constructor";

    /** Identifier path, e.g. ["langchain", "llms", "openai", "OpenAI"] */
    @Builder.Default
    private List<String> id = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> kwargs = new LinkedHashMap<>();

    public static Serialized of(String... idPath) {
        return Serialized.builder().id(List.of(idPath)).build();
    }

    /**
     * Display name of the run: the last segment of the identifier path.
     */
    public String name() {
        if (id == null || id.isEmpty()) return "unknown";
        return id.get(id.size() - 1);
    }
}
