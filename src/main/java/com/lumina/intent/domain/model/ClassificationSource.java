package com.lumina.intent.domain.model;

public enum ClassificationSource {
    RULE("rule"),
    LLM("llm"),
    GUARDRAIL("guardrail");

    private final String value;

    ClassificationSource(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
