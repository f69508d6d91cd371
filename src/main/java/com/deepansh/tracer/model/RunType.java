package com.deepansh.tracer.model;

/**
 * Kind of traced work. Chat-model invocations are recorded as {@link #llm}.
 */
public enum RunType {
    llm, chain, tool
}
