package com.mailrag.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailrag.inference.ChatMessage;
import com.mailrag.inference.TextGenerationService;
import com.mailrag.store.DimensionMismatchException;

public class AnswerService {
    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    static final String GENERATION_ERROR = "I apologize, but there was an error connecting to the language model. "
            + "Please check your credentials and internet connection.";
    static final String EMPTY_RESPONSE = "I apologize, but I received an empty response from the AI model.";
    static final String RETRIEVAL_ERROR = "I apologize, but I could not search your emails because the embedding "
            + "configuration does not match the stored index.";

    private final ContextAssembler contextAssembler;
    private final TextGenerationService generationService;
    private final String persona;
    private final long timeoutMs;

    public AnswerService(ContextAssembler contextAssembler, TextGenerationService generationService, String persona, long timeoutMs) {
        this.contextAssembler = contextAssembler;
        this.generationService = generationService;
        this.persona = persona == null ? "" : persona.strip();
        this.timeoutMs = timeoutMs;
    }

    public String ask(String question, Conversation conversation) {
        ChatMessage userTurn = ChatMessage.user(question);
        if (conversation.isNew()) {
            RetrievedContext context;
            try {
                context = contextAssembler.assemble(question);
            } catch (DimensionMismatchException e) {
                // conversation stays unstarted so the next question retries retrieval
                log.error("ask.retrieve.failed reason={}", e.getMessage(), e);
                conversation.append(userTurn, ChatMessage.assistant(RETRIEVAL_ERROR));
                return RETRIEVAL_ERROR;
            }
            log.info("ask.retrieved items={} fallback={}", context.items().size(), context.fallback());
            conversation.start(persona + "\n\n" + context.block());
        }

        List<ChatMessage> history = new ArrayList<>(conversation.turns());
        history.add(userTurn);
        String reply = generateWithTimeout(conversation.systemContext(), history);
        conversation.append(userTurn, ChatMessage.assistant(reply));
        return reply;
    }

    private String generateWithTimeout(String systemContext, List<ChatMessage> history) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> future = executor.submit(() -> generationService.generate(systemContext, history));
            String reply = timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
            if (reply == null || reply.isBlank()) {
                return EMPTY_RESPONSE;
            }
            return reply.strip();
        } catch (TimeoutException e) {
            log.warn("Generation timed out after {} ms", timeoutMs);
            return "I could not complete generation within the configured timeout of " + timeoutMs
                    + "ms. Please retry with a shorter question.";
        } catch (ExecutionException e) {
            log.error("Generation failed", e.getCause());
            return GENERATION_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Generation interrupted.";
        } finally {
            executor.shutdownNow();
        }
    }
}
