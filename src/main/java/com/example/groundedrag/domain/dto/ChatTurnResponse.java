package com.example.groundedrag.domain.dto;

import com.example.groundedrag.domain.model.AnswerOutcome;
import com.example.groundedrag.domain.model.Citation;
import com.example.groundedrag.domain.model.MemoryWrite;
import java.util.List;

public record ChatTurnResponse(
        String answer,
        List<Citation> citations,
        AnswerOutcome outcome,
        List<MemoryWrite> memoryWrites
) {
}
