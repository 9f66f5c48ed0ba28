package com.example.groundedrag.application.service;

import com.example.groundedrag.domain.model.AnswerOutcome;
import com.example.groundedrag.domain.model.Citation;
import com.example.groundedrag.domain.model.GroundedAnswer;
import com.example.groundedrag.domain.model.RetrievedRecord;
import com.example.groundedrag.infrastructure.llm.CompletionResult;
import com.example.groundedrag.infrastructure.llm.LlmClient;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    static final String NO_RELEVANT_INFORMATION =
            "I couldn't find relevant information in the uploaded documents. "
                    + "Please upload documents first or try a different question.";

    private static final String CITATION_PROMPT = """
            You are a helpful assistant that answers questions based ONLY on the provided context.
            If the answer cannot be found in the context, say "I couldn't find relevant information in the uploaded documents."
            Do NOT make up information or cite sources that don't exist.

            Context (retrieved passages):
            {context}

            For each fact you state, cite the source using this exact format: {markup}
            Example: [Source: report.pdf, Locator: Overview (chunk 2)]

            Question: {question}

            Answer (with inline citations):""";

    private final RetrievalService retrievalService;
    private final CitationFormatter citationFormatter;
    private final LlmClient llmClient;

    public AnswerService(
            RetrievalService retrievalService,
            CitationFormatter citationFormatter,
            LlmClient llmClient
    ) {
        this.retrievalService = retrievalService;
        this.citationFormatter = citationFormatter;
        this.llmClient = llmClient;
    }

    /**
     * Pipeline:
     * retrieve -> context + citations -> completion -> answer.
     * Citations computed from retrieval are returned whatever happens to the generation step.
     */
    public GroundedAnswer answer(String question, int topK) {
        long t0 = System.nanoTime();

        List<RetrievedRecord> records = retrievalService.retrieve(question, topK);
        if (records.isEmpty()) {
            log.info("event=answer_no_grounding");
            return new GroundedAnswer(NO_RELEVANT_INFORMATION, List.of(), AnswerOutcome.NO_GROUNDING);
        }

        CitationFormatter.FormattedContext formatted = citationFormatter.format(records);
        List<Citation> citations = formatted.citations();
        String topSnippet = records.get(0).snippet();

        GroundedAnswer result;
        if (!llmClient.isAvailable()) {
            result = notConfigured(topSnippet, citations);
        } else {
            CompletionResult completion = llmClient.complete(buildPrompt(question, formatted.context()));
            result = switch (completion.status()) {
                case SUCCESS -> new GroundedAnswer(completion.text().trim(), citations, AnswerOutcome.GENERATED);
                case UNAVAILABLE -> new GroundedAnswer(
                        "LLM unavailable (" + completion.error() + "). Top result: " + prefix(topSnippet, 100) + "...",
                        citations, AnswerOutcome.LLM_UNAVAILABLE);
                case TRANSIENT_FAILURE -> new GroundedAnswer(
                        transientAdvisory(completion.error(), topSnippet), citations, AnswerOutcome.LLM_TRANSIENT_FAILURE);
                case FAILED -> new GroundedAnswer(
                        "The language model request failed (" + completion.error() + "). "
                                + "The passages listed in the citations are the closest matches to your question.",
                        citations, AnswerOutcome.LLM_FAILED);
            };
        }

        log.info("event=answer_done outcome={} records={} citations={} ms={}",
                result.outcome(), records.size(), citations.size(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    String buildPrompt(String question, String context) {
        return CITATION_PROMPT
                .replace("{markup}", CitationFormatter.markup("filename", "locator"))
                .replace("{question}", question == null ? "" : question.trim())
                .replace("{context}", context);
    }

    private static GroundedAnswer notConfigured(String topSnippet, List<Citation> citations) {
        String text = "No LLM configured. Set groundedrag.llm.provider=ollama for a local model, "
                + "or provide OPENAI_API_KEY for OpenAI. Top result: " + prefix(topSnippet, 100) + "...";
        return new GroundedAnswer(text, citations, AnswerOutcome.LLM_UNAVAILABLE);
    }

    private static String transientAdvisory(String error, String topSnippet) {
        String err = error == null ? "" : error.toLowerCase(Locale.ROOT);
        String reason = err.contains("429") || err.contains("quota") || err.contains("rate limit")
                ? "LLM unavailable - quota or rate limit exceeded"
                : "LLM temporarily unavailable";
        return "Relevant passages retrieved (" + reason + "). Please try again later. "
                + "Top result: " + prefix(topSnippet, 150) + "...";
    }

    private static String prefix(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }
}
