package com.mailrag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class DataSources {
    private DataSources() {
    }

    public static String sqliteUrl(Path dbFile) {
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    public static String toJdbcUrl(String databaseUrl) {
        if (databaseUrl == null || databaseUrl.isBlank()) {
            throw new IllegalArgumentException("database url must not be blank");
        }
        String url = databaseUrl.trim();
        if (url.startsWith("jdbc:")) {
            return url;
        }
        if (url.startsWith("postgres://")) {
            return "jdbc:postgresql://" + url.substring("postgres://".length());
        }
        if (url.startsWith("postgresql://")) {
            return "jdbc:" + url;
        }
        throw new IllegalArgumentException("Unsupported database url scheme: " + url);
    }

    public static HikariDataSource create(String jdbcUrl, String username, String password, int poolSize) {
        SqlDialect dialect = SqlDialect.fromJdbcUrl(jdbcUrl);
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("mail-rag-" + dialect.name().toLowerCase(java.util.Locale.ROOT));
        if (dialect == SqlDialect.SQLITE) {
            createParentDirectories(jdbcUrl.substring("jdbc:sqlite:".length()));
            config.setDriverClassName("org.sqlite.JDBC");
            config.setMaximumPoolSize(1);
        } else {
            config.setMaximumPoolSize(Math.max(1, poolSize));
        }
        if (username != null && !username.isBlank()) {
            config.setUsername(username);
        }
        if (password != null && !password.isBlank()) {
            config.setPassword(password);
        }
        config.setLeakDetectionThreshold(30000);
        try {
            return new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StorageException("Unable to open database " + jdbcUrl, e);
        }
    }

    private static void createParentDirectories(String sqlitePath) {
        if (sqlitePath.isBlank() || sqlitePath.startsWith(":memory:") || sqlitePath.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(sqlitePath).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Unable to create database directory " + parent, e);
        }
    }
}
