package com.deepansh.tracer.model;

public enum MessageType {
    human, ai, system, generic
}
