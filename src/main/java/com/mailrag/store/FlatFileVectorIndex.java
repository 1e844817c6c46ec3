package com.mailrag.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

public class FlatFileVectorIndex implements VectorIndex {
    private final Path path;
    private final int dimension;
    private final List<IndexedVector> entries = new ArrayList<>();
    private final Map<String, Long> positions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FlatFileVectorIndex(Path path, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.path = path;
        this.dimension = dimension;
    }

    public static FlatFileVectorIndex load(Path path, int dimension) throws IOException {
        FlatFileVectorIndex index = new FlatFileVectorIndex(path, dimension);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return index;
        }
        IndexFile file = index.objectMapper.readValue(path.toFile(), IndexFile.class);
        if (file.dimension() != dimension) {
            throw new DimensionMismatchException("Vector index " + path, dimension, file.dimension());
        }
        List<IndexedVector> loaded = file.entries() == null ? List.of() : file.entries();
        for (IndexedVector entry : loaded) {
            if (entry.embedding().length != dimension) {
                throw new DimensionMismatchException("Index entry " + entry.sourceId(), dimension, entry.embedding().length);
            }
            index.positions.put(entry.sourceId(), (long) index.entries.size());
            index.entries.add(new IndexedVector(index.entries.size(), entry.sourceId(), entry.embedding()));
        }
        return index;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public long add(String sourceId, float[] embedding) {
        if (embedding.length != dimension) {
            throw new DimensionMismatchException("Embedding for " + sourceId, dimension, embedding.length);
        }
        lock.writeLock().lock();
        try {
            if (positions.containsKey(sourceId)) {
                throw new IllegalArgumentException("Already indexed: " + sourceId);
            }
            long position = entries.size();
            entries.add(new IndexedVector(position, sourceId, embedding.clone()));
            positions.put(sourceId, position);
            return position;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public OptionalLong positionOf(String sourceId) {
        lock.readLock().lock();
        try {
            Long position = positions.get(sourceId);
            return position == null ? OptionalLong.empty() : OptionalLong.of(position);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IndexHit> search(float[] queryEmbedding, int topK) {
        if (queryEmbedding.length != dimension) {
            throw new DimensionMismatchException("Query embedding", dimension, queryEmbedding.length);
        }
        List<VectorMath.Scored<IndexedVector>> scored;
        lock.readLock().lock();
        try {
            scored = new ArrayList<>(entries.size());
            for (IndexedVector entry : entries) {
                scored.add(new VectorMath.Scored<>(entry, VectorMath.squaredL2(queryEmbedding, entry.embedding()), entry.position()));
            }
        } finally {
            lock.readLock().unlock();
        }
        return VectorMath.nearest(scored, topK).stream()
                .map(hit -> new IndexHit(hit.item().position(), hit.item().sourceId(), hit.distance()))
                .toList();
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        lock.readLock().lock();
        try {
            objectMapper.writeValue(tmp.toFile(), new IndexFile(dimension, List.copyOf(entries)));
        } finally {
            lock.readLock().unlock();
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndexedVector(long position, String sourceId, float[] embedding) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndexFile(int dimension, List<IndexedVector> entries) {
    }
}
