package com.example.compliance.service;

import com.example.compliance.exception.PersistenceException;
import com.example.compliance.repository.AtomicFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Durable content-addressed cache for embeddings and LLM responses, shared by all projects.
 * <p>
 * Layout: {@code <root>/<key[0..2]>/<key>.json.gz}. Every {@link #put} reaches disk before it
 * returns. Entries never expire; {@link #clear()} is the only removal path. An entry that cannot
 * be read is treated as a miss, so a damaged store degrades to recomputation.
 */
public class ContentCache {

    private static final Logger log = LoggerFactory.getLogger(ContentCache.class);

    private final Path root;
    private final ObjectMapper objectMapper;
    private final Map<String, JsonNode> memory = new ConcurrentHashMap<>();

    public ContentCache(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> get(String key) {
        JsonNode node = memory.get(key);
        if (node == null) {
            node = readEntry(key);
            if (node != null) {
                memory.put(key, node);
            }
        }
        return Optional.ofNullable(node);
    }

    /** Typed lookup; an entry that no longer binds to {@code type} is a miss. */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).flatMap(node -> {
            try {
                return Optional.ofNullable(objectMapper.treeToValue(node, type));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Cache entry {} does not bind to {}, treating as miss: {}",
                        key, type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    public Optional<float[]> getEmbedding(String key) {
        return get(key, float[].class).filter(v -> v.length > 0);
    }

    /**
     * Stores {@code value} and flushes it to disk.
     *
     * @throws PersistenceException if the entry cannot be written
     */
    public void put(String key, Object value) {
        JsonNode node = objectMapper.valueToTree(value);
        Path file = entryPath(key);
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
                objectMapper.writeValue(gzip, node);
            }
            AtomicFiles.write(file, buffer.toByteArray());
        } catch (IOException e) {
            throw new PersistenceException("Unable to write cache entry " + file + ": " + e.getMessage(), e);
        }
        memory.put(key, node);
    }

    /** Removes every entry, in memory and on disk. */
    public void clear() {
        memory.clear();
        if (!Files.isDirectory(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                if (!p.equals(root)) {
                    Files.deleteIfExists(p);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Unable to clear cache " + root + ": " + e.getMessage(), e);
        }
        log.info("Content cache cleared ({})", root);
    }

    private JsonNode readEntry(String key) {
        Path file = entryPath(key);
        if (!Files.isRegularFile(file)) return null;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            log.warn("Unreadable cache entry {}, treating as miss: {}", file, e.getMessage());
            return null;
        }
    }

    private Path entryPath(String key) {
        String shard = key.length() >= 2 ? key.substring(0, 2) : "00";
        return root.resolve(shard).resolve(key + ".json.gz");
    }
}
