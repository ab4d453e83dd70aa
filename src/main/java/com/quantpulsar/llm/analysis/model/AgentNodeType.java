package com.quantpulsar.llm.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Role of a span in an agent workflow graph. */
public enum AgentNodeType {
    LLM_CALL("llm_call"),
    TOOL_INVOCATION("tool_invocation"),
    AGENT_HANDOFF("agent_handoff"),
    MEMORY_READ("memory_read"),
    MEMORY_WRITE("memory_write"),
    DECISION("decision"),
    INPUT("input"),
    OUTPUT("output");

    private final String value;

    AgentNodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
