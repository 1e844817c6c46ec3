package com.mailrag.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailrag.store.BackendKind;
import com.mailrag.store.DataSources;
import com.mailrag.store.DimensionMismatchException;
import com.mailrag.store.IndexedStorageBackend;
import com.mailrag.store.RelationalStorageBackend;
import com.mailrag.store.StorageBackend;

public final class StorageBackends {
    private static final Logger log = LoggerFactory.getLogger(StorageBackends.class);

    static final String DATABASE_URL = "DATABASE_URL";
    static final List<String> HOSTING_MARKERS = List.of(
            "STREAMLIT_SHARING",
            "DYNO",
            "RAILWAY_ENVIRONMENT",
            "VERCEL",
            "RENDER",
            "FLY_APP_NAME");

    private StorageBackends() {
    }

    public static BackendKind selectKind(AppConfig.StorageConfig config, Map<String, String> environment) {
        String configured = config.getBackend() == null ? "auto" : config.getBackend().trim();
        if (!"auto".equals(configured.toLowerCase(Locale.ROOT))) {
            return BackendKind.parse(configured);
        }
        if (isSet(environment.get(DATABASE_URL))) {
            return BackendKind.RELATIONAL;
        }
        for (String marker : HOSTING_MARKERS) {
            if (isSet(environment.get(marker))) {
                return BackendKind.RELATIONAL;
            }
        }
        if ("true".equalsIgnoreCase(environment.getOrDefault("PRODUCTION", ""))) {
            return BackendKind.RELATIONAL;
        }
        return BackendKind.INDEXED;
    }

    public static StorageBackend open(AppConfig config, Map<String, String> environment) {
        AppConfig.StorageConfig storage = config.getStorage();
        if (storage.getDimension() != config.getEmbedding().getDimension()) {
            throw new DimensionMismatchException("Embedding configuration",
                    storage.getDimension(), config.getEmbedding().getDimension());
        }
        BackendKind kind = selectKind(storage, environment);
        Path dataDir = Path.of(storage.getDataDir());
        StorageBackend backend = switch (kind) {
            case INDEXED -> IndexedStorageBackend.open(
                    dataDir.resolve(storage.getIndexFile()),
                    dataDir.resolve(storage.getMetadataFile()),
                    dataDir.resolve(storage.getCheckpointFile()),
                    storage.getDimension());
            case RELATIONAL -> RelationalStorageBackend.open(
                    relationalUrl(storage, environment),
                    storage.getUsername(),
                    storage.getPassword(),
                    storage.getPoolSize(),
                    storage.getDimension(),
                    storage.getSearchWindow());
        };
        log.info("storage.open backend={} dimension={} records={}", backend.kind(), backend.dimension(), backend.count());
        return backend;
    }

    static String relationalUrl(AppConfig.StorageConfig storage, Map<String, String> environment) {
        String databaseUrl = environment.get(DATABASE_URL);
        if (isSet(databaseUrl)) {
            return DataSources.toJdbcUrl(databaseUrl);
        }
        if (isSet(storage.getJdbcUrl())) {
            return DataSources.toJdbcUrl(storage.getJdbcUrl());
        }
        return DataSources.sqliteUrl(Path.of(storage.getDataDir()).resolve("emails.db"));
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
