package com.example.groundedrag.domain.model;

import java.util.List;

public record GroundedAnswer(
        String answer,
        List<Citation> citations,
        AnswerOutcome outcome
) {
}
