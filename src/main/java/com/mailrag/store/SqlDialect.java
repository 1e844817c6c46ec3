package com.mailrag.store;

public enum SqlDialect {
    SQLITE("INTEGER PRIMARY KEY AUTOINCREMENT", "BLOB"),
    POSTGRESQL("BIGSERIAL PRIMARY KEY", "BYTEA");

    private final String autoIncrementKey;
    private final String blobType;

    SqlDialect(String autoIncrementKey, String blobType) {
        this.autoIncrementKey = autoIncrementKey;
        this.blobType = blobType;
    }

    public String autoIncrementKey() {
        return autoIncrementKey;
    }

    public String blobType() {
        return blobType;
    }

    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("jdbcUrl must not be null");
        }
        if (jdbcUrl.startsWith("jdbc:sqlite:")) {
            return SQLITE;
        }
        if (jdbcUrl.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
    }
}
