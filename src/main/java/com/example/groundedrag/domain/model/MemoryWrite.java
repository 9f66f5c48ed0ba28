package com.example.groundedrag.domain.model;

public record MemoryWrite(MemoryTarget target, String summary) {
}
