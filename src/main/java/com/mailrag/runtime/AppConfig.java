package com.mailrag.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mailrag.ingest.WindowMode;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private GenerationConfig generation = new GenerationConfig();
    private ContinuousModeConfig continuous = new ContinuousModeConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation == null ? new GenerationConfig() : generation;
    }

    public ContinuousModeConfig getContinuous() {
        return continuous;
    }

    public void setContinuous(ContinuousModeConfig continuous) {
        this.continuous = continuous == null ? new ContinuousModeConfig() : continuous;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String backend = "auto";
        private String dataDir = ".mailrag";
        private String indexFile = "index_email.json";
        private String metadataFile = "index_email_metadata.db";
        private String checkpointFile = "last_checked.json";
        private String jdbcUrl;
        private String username;
        private String password;
        private int poolSize = 4;
        private int dimension = 1536;
        private int searchWindow = 100;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getIndexFile() {
            return indexFile;
        }

        public void setIndexFile(String indexFile) {
            this.indexFile = indexFile;
        }

        public String getMetadataFile() {
            return metadataFile;
        }

        public void setMetadataFile(String metadataFile) {
            this.metadataFile = metadataFile;
        }

        public String getCheckpointFile() {
            return checkpointFile;
        }

        public void setCheckpointFile(String checkpointFile) {
            this.checkpointFile = checkpointFile;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getSearchWindow() {
            return searchWindow;
        }

        public void setSearchWindow(int searchWindow) {
            this.searchWindow = searchWindow;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private WindowMode windowMode = WindowMode.MONTH_TO_DATE;
        private int trailingDays = 30;
        private int maxRecordsPerRun = 20;
        private List<String> queries = new ArrayList<>();
        private List<String> relevanceTerms = new ArrayList<>();
        private int summaryBodyLimit = 500;

        public WindowMode getWindowMode() {
            return windowMode;
        }

        public void setWindowMode(WindowMode windowMode) {
            this.windowMode = windowMode == null ? WindowMode.MONTH_TO_DATE : windowMode;
        }

        public int getTrailingDays() {
            return trailingDays;
        }

        public void setTrailingDays(int trailingDays) {
            this.trailingDays = trailingDays;
        }

        public int getMaxRecordsPerRun() {
            return maxRecordsPerRun;
        }

        public void setMaxRecordsPerRun(int maxRecordsPerRun) {
            this.maxRecordsPerRun = maxRecordsPerRun;
        }

        public List<String> getQueries() {
            return queries;
        }

        public void setQueries(List<String> queries) {
            this.queries = queries == null ? new ArrayList<>() : queries;
        }

        public List<String> getRelevanceTerms() {
            return relevanceTerms;
        }

        public void setRelevanceTerms(List<String> relevanceTerms) {
            this.relevanceTerms = relevanceTerms == null ? new ArrayList<>() : relevanceTerms;
        }

        public int getSummaryBodyLimit() {
            return summaryBodyLimit;
        }

        public void setSummaryBodyLimit(int summaryBodyLimit) {
            this.summaryBodyLimit = summaryBodyLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 25;
        private String itemLabel = "Email";
        private String assistantPersona = "You are an AI assistant with access to the user's email collection. "
                + "Below, you'll find the most relevant emails retrieved for the user's question. "
                + "Answer the question based on these emails. "
                + "If you cannot find the answer in the emails, politely inform the user. "
                + "Answer in a conversational, helpful manner as a personal email assistant.";
        private int generationTimeoutMs = 60000;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public String getItemLabel() {
            return itemLabel;
        }

        public void setItemLabel(String itemLabel) {
            this.itemLabel = itemLabel;
        }

        public String getAssistantPersona() {
            return assistantPersona;
        }

        public void setAssistantPersona(String assistantPersona) {
            this.assistantPersona = assistantPersona;
        }

        public int getGenerationTimeoutMs() {
            return generationTimeoutMs;
        }

        public void setGenerationTimeoutMs(int generationTimeoutMs) {
            this.generationTimeoutMs = generationTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private String endpoint;
        private String apiKeyEnv = "MAILRAG_EMBEDDING_API_KEY";
        private int dimension = 1536;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationConfig {
        private String endpoint;
        private String apiKeyEnv = "MAILRAG_GENERATION_API_KEY";
        private String model = "default";
        private int maxTokens = 1000;
        private double temperature = 0.3;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContinuousModeConfig {
        private long ingestIntervalMs = 300000;
        private long maxCycles = 0;
        private long maxRuntimeMs = 0;

        public long getIngestIntervalMs() {
            return ingestIntervalMs;
        }

        public void setIngestIntervalMs(long ingestIntervalMs) {
            this.ingestIntervalMs = ingestIntervalMs;
        }

        public long getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(long maxCycles) {
            this.maxCycles = maxCycles;
        }

        public long getMaxRuntimeMs() {
            return maxRuntimeMs;
        }

        public void setMaxRuntimeMs(long maxRuntimeMs) {
            this.maxRuntimeMs = maxRuntimeMs;
        }
    }
}
