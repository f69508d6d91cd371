package com.deepansh.tracer.model;

/**
 * Chat message in the shape it is recorded under a run's "messages" input.
 */
public record StoredMessage(String type, Data data) {

    public record Data(String content, String role) {}
}
