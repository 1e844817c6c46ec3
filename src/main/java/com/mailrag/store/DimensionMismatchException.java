package com.mailrag.store;

public class DimensionMismatchException extends IllegalStateException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + " has dimension " + actual + " but the store is configured for " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
