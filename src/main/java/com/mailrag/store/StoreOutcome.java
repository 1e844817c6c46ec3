package com.mailrag.store;

public record StoreOutcome(Status status, String reason) {

    public enum Status {
        INSERTED,
        ALREADY_EXISTS,
        FAILED
    }

    private static final StoreOutcome INSERTED = new StoreOutcome(Status.INSERTED, "");
    private static final StoreOutcome ALREADY_EXISTS = new StoreOutcome(Status.ALREADY_EXISTS, "");

    public static StoreOutcome inserted() {
        return INSERTED;
    }

    public static StoreOutcome alreadyExists() {
        return ALREADY_EXISTS;
    }

    public static StoreOutcome failed(String reason) {
        return new StoreOutcome(Status.FAILED, reason == null ? "unknown" : reason);
    }

    public boolean isInserted() {
        return status == Status.INSERTED;
    }

    public boolean isAlreadyExists() {
        return status == Status.ALREADY_EXISTS;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
