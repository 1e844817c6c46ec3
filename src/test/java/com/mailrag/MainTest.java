package com.mailrag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path exportPath;

    @BeforeEach
    void writeFixtures() throws Exception {
        configPath = tempDir.resolve("mail-rag.yml");
        Files.writeString(configPath, """
                storage:
                  backend: indexed
                  dataDir: %s
                  dimension: 512
                embedding:
                  provider: hashing
                  dimension: 512
                ingestion:
                  relevanceTerms:
                    - alice
                """.formatted(tempDir.resolve("data").toString().replace("\\", "/")));
        exportPath = tempDir.resolve("export.json");
        Files.writeString(exportPath, """
                [
                  {"id": "m1", "from": "alice@example.com", "subject": "Invoice 42", "date": "2026-10-10T09:00:00Z", "body": "Due Friday."},
                  {"id": "m2", "from": "alice@example.com", "subject": "Team offsite", "date": "2026-10-12T09:00:00Z", "body": "Berlin."},
                  {"id": "m3", "from": "newsletter@example.com", "subject": "Deals", "date": "2026-10-12T10:00:00Z", "body": "Buy."}
                ]
                """);
    }

    private Result execute(String... args) {
        Main main = new Main();
        main.environment = Map.of();
        main.clock = Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC);
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(main);
        commandLine.setOut(new PrintWriter(out));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString());
    }

    private record Result(int exitCode, String output) {
    }

    @Test
    void shouldIngestExportThenReportStatus() {
        Result ingest = execute("--config", configPath.toString(), "--mode", "ingest", "--source-file", exportPath.toString());
        assertEquals(0, ingest.exitCode());
        assertTrue(ingest.output().contains("Ingested 2 new email(s)"), ingest.output());

        Result again = execute("--config", configPath.toString(), "--mode", "ingest", "--source-file", exportPath.toString());
        assertTrue(again.output().contains("Ingested 0 new email(s)"), again.output());
        assertTrue(again.output().contains("duplicates=2"), again.output());

        Result status = execute("--config", configPath.toString(), "--mode", "status");
        assertEquals(0, status.exitCode());
        assertTrue(status.output().contains("backend=INDEXED dimension=512 records=2 lastSync=2026-10-17T12:00:00Z"), status.output());
    }

    @Test
    void shouldPrintNumberedContextForSearch() {
        execute("--config", configPath.toString(), "--mode", "ingest", "--source-file", exportPath.toString());

        Result search = execute("--config", configPath.toString(), "--mode", "search", "--query", "invoice", "--top-k", "1");

        assertEquals(0, search.exitCode());
        assertTrue(search.output().startsWith("Today's Datetime is 2026-10-17T12:00Z"), search.output());
        assertTrue(search.output().contains("Email(1):"), search.output());
        assertTrue(search.output().contains("Subject: Invoice 42"), search.output());
    }

    @Test
    void shouldReturnUsageErrorWhenRequiredInputIsMissing() {
        assertEquals(2, execute("--config", configPath.toString(), "--mode", "ingest").exitCode());
        assertEquals(2, execute("--config", configPath.toString(), "--mode", "search").exitCode());
        assertEquals(2, execute("--config", configPath.toString(), "--mode", "ask", "--query", "hi").exitCode());
    }

    @Test
    void shouldRespectBackendOverride() {
        Result status = execute("--config", configPath.toString(), "--mode", "status", "--backend", "relational");

        assertEquals(0, status.exitCode());
        assertTrue(status.output().contains("backend=RELATIONAL"), status.output());
    }
}
