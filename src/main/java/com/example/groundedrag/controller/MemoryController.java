package com.example.groundedrag.controller;

import com.example.groundedrag.application.service.MemoryService;
import com.example.groundedrag.controller.exception.BusinessException;
import com.example.groundedrag.domain.dto.MemoryTurnRequest;
import com.example.groundedrag.domain.dto.ResponseData;
import com.example.groundedrag.domain.model.MemoryTarget;
import com.example.groundedrag.domain.model.MemoryWrite;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    private final MemoryService memoryService;

    public MemoryController(MemoryService memoryService) {
        this.memoryService = memoryService;
    }

    @PostMapping(
            path = "/turns",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<List<MemoryWrite>>> processTurn(@Valid @RequestBody MemoryTurnRequest request) {
        List<MemoryWrite> writes = memoryService.processMemory(request.getUserMessage(), request.getAssistantMessage());

        ResponseData<List<MemoryWrite>> response = ResponseData.of(HttpStatus.OK,
                writes.isEmpty() ? "Nothing new to remember" : "Remembered " + writes.size() + " fact(s)", writes);

        return ResponseEntity.ok(response);
    }

    @GetMapping(path = "/{target}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<List<String>>> read(@PathVariable("target") String target) {
        MemoryTarget parsed = MemoryTarget.parse(target)
                .orElseThrow(() -> new BusinessException(HttpStatus.NOT_FOUND, "Unknown memory target: " + target));

        ResponseData<List<String>> response = ResponseData.of(HttpStatus.OK, parsed.name(), memoryService.read(parsed));

        return ResponseEntity.ok(response);
    }
}
