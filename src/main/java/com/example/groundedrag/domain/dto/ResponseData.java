package com.example.groundedrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Success envelope for every endpoint; failures use {@link com.example.groundedrag.controller.exception.ErrorResponse}.
 */
@Builder
@Getter
public class ResponseData<T> {
    private int status;
    private String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private T data;

    public static <T> ResponseData<T> of(HttpStatus status, String message, T data) {
        return ResponseData.<T>builder()
                .status(status.value())
                .message(message)
                .data(data)
                .build();
    }
}
