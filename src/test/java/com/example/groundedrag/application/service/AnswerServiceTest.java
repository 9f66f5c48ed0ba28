package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.model.AnswerOutcome;
import com.example.groundedrag.domain.model.Citation;
import com.example.groundedrag.domain.model.GroundedAnswer;
import com.example.groundedrag.domain.model.RetrievedRecord;
import com.example.groundedrag.infrastructure.llm.CompletionResult;
import com.example.groundedrag.infrastructure.llm.LlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AnswerServiceTest {

    private static final List<RetrievedRecord> RECORDS = List.of(
            new RetrievedRecord("Invoices are due in 30 days.", "terms.md", "Payment (chunk 0)", "Invoices are due in 30 days."),
            new RetrievedRecord("Late fees apply after 45 days.", "terms.md", "Payment (chunk 1)", "Late fees apply after 45 days."),
            new RetrievedRecord("Invoices are due in 30 days.", "terms.md", "Payment (chunk 0)", "Invoices are due in 30 days.")
    );

    private RetrievalService retrievalService;
    private LlmClient llmClient;
    private AnswerService service;

    @BeforeEach
    void setUp() {
        retrievalService = mock(RetrievalService.class);
        llmClient = mock(LlmClient.class);
        service = new AnswerService(retrievalService, new CitationFormatter(), llmClient);
    }

    @Test
    void emptyRetrievalShortCircuitsWithoutCallingModel() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(List.of());

        GroundedAnswer answer = service.answer("when are invoices due?", 5);

        assertEquals(AnswerService.NO_RELEVANT_INFORMATION, answer.answer());
        assertTrue(answer.citations().isEmpty());
        assertEquals(AnswerOutcome.NO_GROUNDING, answer.outcome());
        verifyNoInteractions(llmClient);
    }

    @Test
    void generatedAnswerCarriesDedupedCitations() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(RECORDS);
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.complete(anyString()))
                .thenReturn(CompletionResult.success("  Within 30 days [Source: terms.md, Locator: Payment (chunk 0)]\n"));

        GroundedAnswer answer = service.answer("when are invoices due?", 5);

        assertEquals(AnswerOutcome.GENERATED, answer.outcome());
        assertEquals("Within 30 days [Source: terms.md, Locator: Payment (chunk 0)]", answer.answer());
        assertEquals(List.of(
                new Citation("terms.md", "Payment (chunk 0)", "Invoices are due in 30 days."),
                new Citation("terms.md", "Payment (chunk 1)", "Late fees apply after 45 days.")
        ), answer.citations());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("[1] (Source: terms.md, Locator: Payment (chunk 0))\nInvoices are due in 30 days."));
        assertTrue(prompt.getValue().contains("[Source: filename, Locator: locator]"));
        assertTrue(prompt.getValue().contains("Question: when are invoices due?"));
    }

    @Test
    void unconfiguredModelFallsBackToTopSnippet() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(RECORDS);
        when(llmClient.isAvailable()).thenReturn(false);

        GroundedAnswer answer = service.answer("when are invoices due?", 5);

        assertEquals(AnswerOutcome.LLM_UNAVAILABLE, answer.outcome());
        assertTrue(answer.answer().startsWith("No LLM configured."));
        assertTrue(answer.answer().contains("Top result: Invoices are due in 30 days."));
        assertEquals(2, answer.citations().size());
        verify(llmClient, never()).complete(anyString());
    }

    @Test
    void timeoutIsTreatedAsUnavailable() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(RECORDS);
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.complete(anyString())).thenReturn(CompletionResult.unavailable("LLM request timed out after 30000 ms"));

        GroundedAnswer answer = service.answer("q", 5);

        assertEquals(AnswerOutcome.LLM_UNAVAILABLE, answer.outcome());
        assertTrue(answer.answer().startsWith("LLM unavailable (LLM request timed out after 30000 ms)."));
        assertFalse(answer.answer().contains("No LLM configured"));
        assertTrue(answer.answer().contains("Top result: Invoices are due in 30 days."));
        assertEquals(2, answer.citations().size());
    }

    @Test
    void quotaFailureKeepsCitations() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(RECORDS);
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.complete(anyString()))
                .thenReturn(CompletionResult.transientFailure("LLM HTTP error 429: insufficient_quota"));

        GroundedAnswer answer = service.answer("q", 5);

        assertEquals(AnswerOutcome.LLM_TRANSIENT_FAILURE, answer.outcome());
        assertTrue(answer.answer().contains("quota or rate limit exceeded"));
        assertTrue(answer.answer().contains("Invoices are due in 30 days."));
        assertEquals(2, answer.citations().size());
    }

    @Test
    void otherFailureKeepsCitations() {
        when(retrievalService.retrieve(anyString(), anyInt())).thenReturn(RECORDS);
        when(llmClient.isAvailable()).thenReturn(true);
        when(llmClient.complete(anyString())).thenReturn(CompletionResult.failed("LLM HTTP error 400: bad model"));

        GroundedAnswer answer = service.answer("q", 5);

        assertEquals(AnswerOutcome.LLM_FAILED, answer.outcome());
        assertEquals(2, answer.citations().size());
    }
}
