package com.mailrag.store;

public record IndexHit(long position, String sourceId, float distance) {
}
