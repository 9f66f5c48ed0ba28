package com.example.groundedrag.domain.model;

public enum AnswerOutcome {
    GENERATED,
    NO_GROUNDING,
    LLM_UNAVAILABLE,
    LLM_TRANSIENT_FAILURE,
    LLM_FAILED
}
