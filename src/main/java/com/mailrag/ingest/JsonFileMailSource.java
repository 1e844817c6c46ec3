package com.mailrag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JsonFileMailSource implements MailSource {
    private static final Logger log = LoggerFactory.getLogger(JsonFileMailSource.class);
    private static final TypeReference<List<ExportedMessage>> MESSAGES = new TypeReference<>() {
    };

    private final Path exportFile;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile Map<String, ExportedMessage> byId;

    public JsonFileMailSource(Path exportFile) {
        this.exportFile = exportFile;
    }

    @Override
    public List<Document> listCandidates(TimeWindow window, String query) throws FetchException {
        List<Clause> clauses = parse(query);
        boolean any = query != null && List.of(query.replace("(", " ").replace(")", " ").split("\\s+")).contains("OR");
        List<ExportedMessage> messages = read();
        byId = index(messages);
        List<Document> candidates = new ArrayList<>();
        for (ExportedMessage message : messages) {
            Document header = toDocument(message, false);
            if (header != null && matches(header, clauses, any)) {
                candidates.add(header);
            }
        }
        log.debug("source.list file={} query='{}' candidates={}", exportFile, query, candidates.size());
        return candidates;
    }

    @Override
    public Document fetch(String sourceId) throws FetchException {
        Map<String, ExportedMessage> messages = byId;
        if (messages == null) {
            messages = index(read());
            byId = messages;
        }
        ExportedMessage message = messages.get(sourceId);
        return message == null ? null : toDocument(message, true);
    }

    private static Map<String, ExportedMessage> index(List<ExportedMessage> messages) {
        Map<String, ExportedMessage> indexed = new HashMap<>();
        for (ExportedMessage message : messages) {
            if (message.id() != null) {
                indexed.putIfAbsent(message.id(), message);
            }
        }
        return indexed;
    }

    private List<ExportedMessage> read() throws FetchException {
        if (!Files.isRegularFile(exportFile)) {
            throw new FetchException("Mail export not found: " + exportFile);
        }
        try {
            List<ExportedMessage> messages = mapper.readValue(exportFile.toFile(), MESSAGES);
            return messages == null ? List.of() : messages;
        } catch (IOException e) {
            throw new FetchException("Unable to read mail export " + exportFile, e);
        }
    }

    private static Document toDocument(ExportedMessage message, boolean withBody) {
        if (message.id() == null || message.id().isBlank()) {
            log.warn("source.skip reason=missing id subject='{}'", message.subject());
            return null;
        }
        return new Document(
                message.id(),
                message.from(),
                message.cc(),
                message.subject(),
                parseDate(message),
                withBody ? (message.body() == null ? "" : message.body()) : null);
    }

    private static Instant parseDate(ExportedMessage message) {
        if (message.date() == null || message.date().isBlank()) {
            return null;
        }
        try {
            return MessageDates.parse(message.date());
        } catch (IllegalArgumentException e) {
            log.warn("source.date.invalid id={} date='{}'", message.id(), message.date());
            return null;
        }
    }

    // from:, subject: and bare terms; after: is dropped, the pipeline applies its own window
    private static List<Clause> parse(String query) {
        List<Clause> clauses = new ArrayList<>();
        if (query == null) {
            return clauses;
        }
        for (String raw : query.replace("(", " ").replace(")", " ").split("\\s+")) {
            if (raw.isBlank() || "OR".equals(raw)) {
                continue;
            }
            String token = raw.toLowerCase(Locale.ROOT);
            if (token.startsWith("after:")) {
                continue;
            }
            if (token.startsWith("from:")) {
                clauses.add(new Clause(Field.SENDER, token.substring("from:".length())));
            } else if (token.startsWith("subject:")) {
                clauses.add(new Clause(Field.SUBJECT, token.substring("subject:".length())));
            } else {
                clauses.add(new Clause(Field.ANY, token));
            }
        }
        return clauses;
    }

    private static boolean matches(Document document, List<Clause> clauses, boolean any) {
        if (clauses.isEmpty()) {
            return true;
        }
        return any
                ? clauses.stream().anyMatch(clause -> clause.matches(document))
                : clauses.stream().allMatch(clause -> clause.matches(document));
    }

    private enum Field {
        SENDER,
        SUBJECT,
        ANY
    }

    private record Clause(Field field, String term) {
        boolean matches(Document document) {
            String sender = document.sender().toLowerCase(Locale.ROOT);
            String subject = document.subject().toLowerCase(Locale.ROOT);
            return switch (field) {
                case SENDER -> sender.contains(term);
                case SUBJECT -> subject.contains(term);
                case ANY -> sender.contains(term) || subject.contains(term);
            };
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportedMessage(String id, String from, String cc, String subject, String date, String body) {
    }
}
