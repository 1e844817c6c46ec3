package com.mailrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.mailrag.inference.ChatMessage;
import com.mailrag.inference.TextGenerationService;
import com.mailrag.ingest.EmbeddingService;
import com.mailrag.ingest.HashingEmbeddingService;

class AnswerServiceTest {
    private static final int DIMENSION = 8;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC);

    private final StubStorageBackend backend = new StubStorageBackend(DIMENSION).returning("Invoice due Friday");
    private final ContextAssembler assembler = new ContextAssembler(new HashingEmbeddingService(DIMENSION), backend, 25, "Email", CLOCK);

    private static final class ScriptedGenerator implements TextGenerationService {
        final List<String> systems = new ArrayList<>();
        final List<List<ChatMessage>> histories = new ArrayList<>();

        @Override
        public String generate(String systemContext, List<ChatMessage> history) {
            systems.add(systemContext);
            histories.add(List.copyOf(history));
            return "reply " + histories.size();
        }
    }

    @Test
    void shouldRetrieveOnceAndReuseContextForFollowUps() {
        ScriptedGenerator generator = new ScriptedGenerator();
        AnswerService service = new AnswerService(assembler, generator, "You are a mail assistant.", 5000);
        Conversation conversation = new Conversation();

        assertEquals("reply 1", service.ask("When is the invoice due?", conversation));
        assertEquals("reply 2", service.ask("And who sent it?", conversation));

        assertEquals(1, backend.searches());
        String system = generator.systems.get(0);
        assertTrue(system.startsWith("You are a mail assistant.\n\nToday's Datetime is "));
        assertTrue(system.contains("Email(1):\n\nInvoice due Friday"));
        assertEquals(system, generator.systems.get(1));
        assertEquals(3, generator.histories.get(1).size());
        assertEquals(ChatMessage.assistant("reply 1"), generator.histories.get(1).get(1));
        assertEquals(4, conversation.turns().size());
    }

    @Test
    void shouldApologizeAndStillRecordTurnWhenGenerationFails() {
        TextGenerationService failing = (system, history) -> {
            throw new IOException("connection refused");
        };
        AnswerService service = new AnswerService(assembler, failing, "persona", 5000);
        Conversation conversation = new Conversation();

        String reply = service.ask("anything?", conversation);

        assertEquals(AnswerService.GENERATION_ERROR, reply);
        assertEquals(List.of(ChatMessage.user("anything?"), ChatMessage.assistant(AnswerService.GENERATION_ERROR)), conversation.turns());
    }

    @Test
    void shouldApologizeInsteadOfThrowingWhenQueryEmbeddingHasWrongLength() {
        EmbeddingService drifting = new EmbeddingService() {
            @Override
            public float[] embed(String text) {
                return new float[DIMENSION + 1];
            }

            @Override
            public int dimension() {
                return DIMENSION;
            }
        };
        ScriptedGenerator generator = new ScriptedGenerator();
        ContextAssembler drifted = new ContextAssembler(drifting, backend, 5, "Email", CLOCK);
        AnswerService service = new AnswerService(drifted, generator, "persona", 5000);
        Conversation conversation = new Conversation();

        String reply = service.ask("anything?", conversation);

        assertEquals(AnswerService.RETRIEVAL_ERROR, reply);
        assertTrue(generator.histories.isEmpty());
        assertTrue(conversation.isNew());
        assertEquals(List.of(ChatMessage.user("anything?"), ChatMessage.assistant(AnswerService.RETRIEVAL_ERROR)), conversation.turns());
    }

    @Test
    void shouldApologizeForEmptyReply() {
        AnswerService service = new AnswerService(assembler, (system, history) -> "  ", "persona", 5000);

        assertEquals(AnswerService.EMPTY_RESPONSE, service.ask("q", new Conversation()));
    }

    @Test
    void shouldGiveUpAfterTimeout() {
        TextGenerationService slow = (system, history) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        };
        AnswerService service = new AnswerService(assembler, slow, "persona", 50);

        String reply = service.ask("q", new Conversation());

        assertTrue(reply.contains("timeout of 50ms"));
    }

    @Test
    void shouldRetrieveAgainAfterReset() {
        ScriptedGenerator generator = new ScriptedGenerator();
        AnswerService service = new AnswerService(assembler, generator, "persona", 5000);
        Conversation conversation = new Conversation();

        service.ask("first", conversation);
        conversation.reset();
        assertTrue(conversation.isNew());
        service.ask("second", conversation);

        assertEquals(2, backend.searches());
        assertFalse(conversation.isNew());
        assertEquals(2, conversation.turns().size());
    }
}
