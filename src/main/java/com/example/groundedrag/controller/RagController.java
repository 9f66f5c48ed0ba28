package com.example.groundedrag.controller;

import com.example.groundedrag.application.service.AnswerService;
import com.example.groundedrag.application.service.ChatService;
import com.example.groundedrag.domain.dto.AskRequest;
import com.example.groundedrag.domain.dto.ChatTurnResponse;
import com.example.groundedrag.domain.dto.IngestResult;
import com.example.groundedrag.domain.dto.ResponseData;
import com.example.groundedrag.domain.model.GroundedAnswer;
import com.example.groundedrag.infrastructure.ingest.IngestService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/rag")
public class RagController {

    private final IngestService ingestService;
    private final AnswerService answerService;
    private final ChatService chatService;

    public RagController(IngestService ingestService, AnswerService answerService, ChatService chatService) {
        this.ingestService = ingestService;
        this.answerService = answerService;
        this.chatService = chatService;
    }

    @PostMapping(
            path = "/documents",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestResult>> ingest(
            @RequestPart("files") List<MultipartFile> files,
            @RequestParam(name = "reset", defaultValue = "true") boolean reset
    ) {
        List<MultipartFile> nonEmpty = files == null ? List.of() : files.stream().filter(f -> !f.isEmpty()).toList();
        if (nonEmpty.isEmpty()) {
            throw new IllegalArgumentException("at least one non-empty file is required");
        }

        ResponseData<IngestResult> response = ResponseData.of(HttpStatus.CREATED, "Documents indexed",
                ingestService.ingestUploads(nonEmpty, reset));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping(path = "/documents/samples", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<IngestResult>> ingestSamples(
            @RequestParam(name = "reset", defaultValue = "true") boolean reset
    ) {
        ResponseData<IngestResult> response = ResponseData.of(HttpStatus.CREATED, "Sample documents indexed", ingestService.ingestSamples(reset));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping(
            path = "/ask",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<GroundedAnswer>> ask(@Valid @RequestBody AskRequest request) {
        ResponseData<GroundedAnswer> response = ResponseData.of(HttpStatus.OK, "Answered",
                answerService.answer(request.getQuestion(), topK(request)));

        return ResponseEntity.ok(response);
    }

    @PostMapping(
            path = "/chat",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<ChatTurnResponse>> chat(@Valid @RequestBody AskRequest request) {
        ResponseData<ChatTurnResponse> response = ResponseData.of(HttpStatus.OK, "Answered",
                chatService.chat(request.getQuestion(), topK(request)));

        return ResponseEntity.ok(response);
    }

    private static int topK(AskRequest request) {
        return request.getTopK() == null ? 0 : request.getTopK();
    }
}
