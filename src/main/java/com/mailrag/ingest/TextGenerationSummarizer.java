package com.mailrag.ingest;

import java.io.IOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.mailrag.inference.ChatMessage;
import com.mailrag.inference.TextGenerationService;

public class TextGenerationSummarizer implements Summarizer {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);
    private static final String INSTRUCTION = """
            Summarize the given Email in the following format, keep it brief but don't lose much information:

            OUTPUT FORMAT:
            <Email Start>
            Date and Time:  (format: dd-MMM-yyyy HH h:mmtt [with time zone])
            Sender:
            CC:
            Subject:
            Email Context:
            <Email End>
            """;

    private final TextGenerationService generationService;

    public TextGenerationSummarizer(TextGenerationService generationService) {
        this.generationService = generationService;
    }

    @Override
    public String summarize(Document document) {
        String prompt = """
                The email is the following:

                date and time: %s
                from: %s
                cc: %s
                subject: %s
                body: %s

                Please summarize this email according to the format above.
                """.formatted(
                document.sentAt() == null ? "unknown" : DATE.format(document.sentAt()),
                document.sender(),
                document.cc(),
                document.subject(),
                document.body() == null ? "" : document.body());
        try {
            String summary = generationService.generate(INSTRUCTION, List.of(ChatMessage.user(prompt)));
            if (summary == null || summary.isBlank()) {
                throw new SummarizationException("Empty summary for " + document.sourceId(), null);
            }
            return summary.strip();
        } catch (IOException e) {
            throw new SummarizationException("Summarization failed for " + document.sourceId(), e);
        }
    }
}
