package com.deepansh.tracer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Generation {

    private String text;

    /** Provider specific, e.g. finish_reason / logprobs */
    private Map<String, Object> generationInfo;
}
