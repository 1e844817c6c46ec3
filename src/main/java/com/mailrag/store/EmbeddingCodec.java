package com.mailrag.store;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

public final class EmbeddingCodec {
    private EmbeddingCodec() {
    }

    public static byte[] encode(float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + embedding.length * Float.BYTES);
        buffer.putInt(embedding.length);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] decode(byte[] data) {
        if (data == null || data.length < Integer.BYTES) {
            throw new IllegalArgumentException("Embedding blob is empty or truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        int length = buffer.getInt();
        if (length < 0 || buffer.remaining() != length * Float.BYTES) {
            throw new IllegalArgumentException("Embedding blob declares " + length
                    + " floats but carries " + buffer.remaining() + " bytes");
        }
        float[] out = new float[length];
        try {
            for (int i = 0; i < length; i++) {
                out[i] = buffer.getFloat();
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Embedding blob is truncated", e);
        }
        return out;
    }
}
