package com.mailrag.ingest;

public enum WindowMode {
    MONTH_TO_DATE,
    TRAILING_DAYS
}
