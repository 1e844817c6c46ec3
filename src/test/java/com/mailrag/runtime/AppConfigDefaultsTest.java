package com.mailrag.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.mailrag.ingest.WindowMode;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToOriginalIngestionAndRetrievalLimits() {
        AppConfig config = new AppConfig();

        assertEquals("auto", config.getStorage().getBackend());
        assertEquals(1536, config.getStorage().getDimension());
        assertEquals(1536, config.getEmbedding().getDimension());
        assertEquals(100, config.getStorage().getSearchWindow());
        assertEquals(20, config.getIngestion().getMaxRecordsPerRun());
        assertEquals(500, config.getIngestion().getSummaryBodyLimit());
        assertEquals(WindowMode.MONTH_TO_DATE, config.getIngestion().getWindowMode());
        assertEquals(25, config.getRetrieval().getTopK());
        assertEquals("Email", config.getRetrieval().getItemLabel());
        assertEquals(1000, config.getGeneration().getMaxTokens());
        assertTrue(config.getIngestion().getQueries().isEmpty());
    }

    @Test
    void shouldReadPartialYamlAndIgnoreUnknownKeys() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue("""
                storage:
                  backend: relational
                  searchWindow: 250
                  legacyOption: true
                ingestion:
                  windowMode: TRAILING_DAYS
                  trailingDays: 14
                  queries:
                    - "from:alice after:{after}"
                retrieval:
                unknownSection:
                  value: 1
                """, AppConfig.class);

        assertEquals("relational", config.getStorage().getBackend());
        assertEquals(250, config.getStorage().getSearchWindow());
        assertEquals(1536, config.getStorage().getDimension());
        assertEquals(WindowMode.TRAILING_DAYS, config.getIngestion().getWindowMode());
        assertEquals(14, config.getIngestion().getTrailingDays());
        assertEquals(List.of("from:alice after:{after}"), config.getIngestion().getQueries());
        assertEquals(25, config.getRetrieval().getTopK());
    }
}
