package com.mailrag;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.mailrag.inference.HttpTextGenerationService;
import com.mailrag.inference.TextGenerationService;
import com.mailrag.ingest.ContinuousIngestionLoop;
import com.mailrag.ingest.EmbeddingService;
import com.mailrag.ingest.EmbeddingServices;
import com.mailrag.ingest.FallbackSummaries;
import com.mailrag.ingest.IngestionPipeline;
import com.mailrag.ingest.IngestionReport;
import com.mailrag.ingest.JsonFileMailSource;
import com.mailrag.ingest.RecordFailure;
import com.mailrag.ingest.RelevanceFilters;
import com.mailrag.ingest.Summarizer;
import com.mailrag.ingest.TextGenerationSummarizer;
import com.mailrag.retrieval.AnswerService;
import com.mailrag.retrieval.ContextAssembler;
import com.mailrag.retrieval.Conversation;
import com.mailrag.retrieval.RetrievedContext;
import com.mailrag.runtime.AppConfig;
import com.mailrag.runtime.StorageBackends;
import com.mailrag.store.StorageBackend;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "mail-rag",
        mixinStandardHelpOptions = true,
        version = "mail-rag 0.1.0",
        description = "Ingests email into a vector store and answers questions over it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--query", description = "Query text for search and ask modes")
    String query;

    @Option(names = "--top-k", description = "Results to retrieve (defaults to retrieval.topK)")
    Integer topK;

    @Option(names = "--source-file", description = "JSON mail export to ingest from")
    Path sourceFile;

    @Option(names = "--backend", description = "Storage backend override (indexed, relational, auto)")
    String backendOverride;

    Map<String, String> environment = System.getenv();
    Clock clock = Clock.systemUTC();

    enum Mode {
        ingest,
        search,
        ask,
        status,
        continuous
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (backendOverride != null && !backendOverride.isBlank()) {
            config.getStorage().setBackend(backendOverride);
        }
        log.info("Starting mail-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(config.getRetrieval().getGenerationTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        try (StorageBackend backend = StorageBackends.open(config, environment)) {
            EmbeddingService embeddingService = EmbeddingServices.create(config.getEmbedding(), httpClient, environment);
            return switch (mode) {
                case ingest -> runIngest(config, backend, embeddingService, httpClient);
                case search -> runSearch(config, backend, embeddingService);
                case ask -> runAsk(config, backend, embeddingService, httpClient);
                case status -> runStatus(backend);
                case continuous -> runContinuous(config, backend, embeddingService, httpClient);
            };
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private int runIngest(AppConfig config, StorageBackend backend, EmbeddingService embeddingService, OkHttpClient httpClient) throws IOException {
        if (sourceFile == null) {
            log.error("--source-file is required in ingest mode");
            return 2;
        }
        IngestionPipeline pipeline = buildPipeline(config, backend, embeddingService, httpClient);
        IngestionReport report = pipeline.run();
        PrintWriter out = out();
        out.printf("Ingested %d new email(s) using query '%s' (candidates=%d duplicates=%d outsideWindow=%d irrelevant=%d failed=%d%s)%n",
                report.stored(),
                report.query(),
                report.candidates(),
                report.duplicates(),
                report.outsideWindow(),
                report.irrelevant(),
                report.failed(),
                report.limitReached() ? " limitReached" : "");
        for (RecordFailure failure : report.failures()) {
            out.printf("  failed %s at %s: %s%n", failure.sourceId(), failure.stage(), failure.reason());
        }
        out.printf("Total stored: %d, last sync: %s%n", backend.count(), report.checkpointAfter());
        out.flush();
        return 0;
    }

    private int runSearch(AppConfig config, StorageBackend backend, EmbeddingService embeddingService) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        ContextAssembler assembler = buildAssembler(config, backend, embeddingService);
        RetrievedContext context = assembler.assemble(query, topK == null ? config.getRetrieval().getTopK() : topK);
        PrintWriter out = out();
        out.print(context.block());
        out.flush();
        return 0;
    }

    private int runAsk(AppConfig config, StorageBackend backend, EmbeddingService embeddingService, OkHttpClient httpClient) throws IOException {
        TextGenerationService generationService = generationService(config, httpClient);
        if (generationService == null) {
            log.error("generation.endpoint is required in ask mode");
            return 2;
        }
        AnswerService answerService = new AnswerService(
                buildAssembler(config, backend, embeddingService),
                generationService,
                config.getRetrieval().getAssistantPersona(),
                config.getRetrieval().getGenerationTimeoutMs());
        Conversation conversation = new Conversation();
        PrintWriter out = out();
        if (query != null && !query.isBlank()) {
            out.println(answerService.ask(query, conversation));
            out.flush();
            return 0;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        out.println("mail-rag ready. Commands: /reset, /exit.");
        while (true) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.trim()) || "/quit".equals(line.trim())) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            if ("/reset".equals(line.trim())) {
                conversation.reset();
                out.println("Conversation reset.");
                continue;
            }
            out.println("assistant> " + answerService.ask(line.trim(), conversation));
        }
        out.flush();
        return 0;
    }

    private int runStatus(StorageBackend backend) {
        PrintWriter out = out();
        out.printf("backend=%s dimension=%d records=%d lastSync=%s%n",
                backend.kind(), backend.dimension(), backend.count(), backend.lastSyncTime());
        out.flush();
        return 0;
    }

    private int runContinuous(AppConfig config, StorageBackend backend, EmbeddingService embeddingService, OkHttpClient httpClient) throws InterruptedException {
        if (sourceFile == null) {
            log.error("--source-file is required in continuous mode");
            return 2;
        }
        IngestionPipeline pipeline = buildPipeline(config, backend, embeddingService, httpClient);
        ContinuousIngestionLoop loop = new ContinuousIngestionLoop(pipeline, config.getContinuous());
        Thread shutdownHook = new Thread(loop::requestStop, "mail-rag-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        ContinuousIngestionLoop.LoopSummary summary;
        try {
            summary = loop.runLoop();
        } finally {
            removeShutdownHook(shutdownHook);
        }
        log.info("Continuous ingestion finished cycles={} successful={} failed={}",
                summary.cycles(), summary.successfulCycles(), summary.failedCycles());
        return summary.failedCycles() > 0 && summary.successfulCycles() == 0 ? 1 : 0;
    }

    private IngestionPipeline buildPipeline(AppConfig config, StorageBackend backend, EmbeddingService embeddingService, OkHttpClient httpClient) {
        TextGenerationService generationService = generationService(config, httpClient);
        int bodyLimit = config.getIngestion().getSummaryBodyLimit();
        Summarizer summarizer = generationService == null
                ? document -> FallbackSummaries.format(document, bodyLimit)
                : new TextGenerationSummarizer(generationService);
        return new IngestionPipeline(
                new JsonFileMailSource(sourceFile),
                backend,
                embeddingService,
                summarizer,
                RelevanceFilters.senderOrSubjectContainsAny(config.getIngestion().getRelevanceTerms()),
                config.getIngestion(),
                clock);
    }

    private ContextAssembler buildAssembler(AppConfig config, StorageBackend backend, EmbeddingService embeddingService) {
        return new ContextAssembler(
                embeddingService,
                backend,
                config.getRetrieval().getTopK(),
                config.getRetrieval().getItemLabel(),
                clock);
    }

    private TextGenerationService generationService(AppConfig config, OkHttpClient httpClient) {
        AppConfig.GenerationConfig generation = config.getGeneration();
        if (generation.getEndpoint() == null || generation.getEndpoint().isBlank()) {
            return null;
        }
        String apiKey = generation.getApiKeyEnv() == null ? null : environment.get(generation.getApiKeyEnv());
        return new HttpTextGenerationService(httpClient, generation, apiKey);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; shutdown hook stays registered");
        }
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }
}
