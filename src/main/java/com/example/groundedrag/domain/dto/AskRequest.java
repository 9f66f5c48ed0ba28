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
public class AskRequest {

    @NotBlank
    private String question;

    // null or <= 0 falls back to the configured default
    private Integer topK;
}
