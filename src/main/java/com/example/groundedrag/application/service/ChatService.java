package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.dto.ChatTurnResponse;
import com.example.groundedrag.domain.model.GroundedAnswer;
import com.example.groundedrag.domain.model.MemoryWrite;
import com.example.groundedrag.infrastructure.memory.MemoryStoreException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One chat turn: grounded answer first, then memory extraction over the question and that answer.
 * A memory failure costs the turn its memory writes, never its answer.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final AnswerService answerService;
    private final MemoryService memoryService;

    public ChatService(AnswerService answerService, MemoryService memoryService) {
        this.answerService = answerService;
        this.memoryService = memoryService;
    }

    public ChatTurnResponse chat(String question, int topK) {
        GroundedAnswer answer = answerService.answer(question, topK);

        List<MemoryWrite> writes;
        try {
            writes = memoryService.processMemory(question, answer.answer());
        } catch (MemoryStoreException e) {
            log.error("event=chat_memory_failed err={}", e.getMessage(), e);
            writes = List.of();
        }
        return new ChatTurnResponse(answer.answer(), answer.citations(), answer.outcome(), writes);
    }
}
