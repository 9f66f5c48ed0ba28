package com.example.groundedrag.domain.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class MemoryTurnRequest {

    @NotBlank
    private String userMessage;

    @NotBlank
    private String assistantMessage;
}
