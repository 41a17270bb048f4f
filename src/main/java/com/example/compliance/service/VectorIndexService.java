package com.example.compliance.service;

import com.example.compliance.exception.InvalidationException;
import com.example.compliance.exception.PersistenceException;
import com.example.compliance.model.ProcedureChunk;
import com.example.compliance.repository.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Builds, persists and reloads {@link VectorIndex} artifacts.
 * <p>
 * An artifact lives at {@code <indexDir>/<buildId>.json}. The build id is derived from the
 * embedding model and every chunk's document hash, ordinal and text hash, so any change to the
 * chunk set yields a new build. Builds are never patched: a changed corpus is indexed from scratch.
 */
@Service
public class VectorIndexService {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexService.class);

    public static String buildId(String embeddingModel, List<ProcedureChunk> chunks) {
        StringJoiner joiner = new StringJoiner("\n");
        joiner.add("index-v1").add(embeddingModel);
        for (ProcedureChunk c : chunks) {
            joiner.add(c.documentHash() + ":" + c.ordinal() + ":" + c.textHash());
        }
        return Hashes.sha256(joiner.toString()).substring(0, 32);
    }

    /**
     * Loads a previously saved build.
     *
     * @return empty if no artifact exists for {@code buildId}
     * @throws InvalidationException if the artifact exists but cannot be loaded
     */
    public Optional<VectorIndex> load(Path indexDir, String buildId, List<ProcedureChunk> chunks,
                                      EmbeddingModel embeddingModel) {
        if (chunks.isEmpty()) {
            return Optional.of(new VectorIndex(buildId, null, chunks));
        }
        Path artifact = artifactPath(indexDir, buildId);
        if (!Files.isRegularFile(artifact)) {
            return Optional.empty();
        }
        try {
            SimpleVectorStore store = SimpleVectorStore.builder(embeddingModel).build();
            store.load(artifact.toFile());
            log.info("Loaded vector index {} ({} chunks)", buildId, chunks.size());
            return Optional.of(new VectorIndex(buildId, store, chunks));
        } catch (RuntimeException e) {
            throw new InvalidationException("Vector index artifact " + artifact + " is unreadable", e);
        }
    }

    /**
     * Embeds every chunk through {@code embeddingModel}, saves the artifact and removes artifacts
     * of older builds.
     */
    public VectorIndex build(Path indexDir, String buildId, List<ProcedureChunk> chunks,
                             EmbeddingModel embeddingModel) {
        if (chunks.isEmpty()) {
            deleteArtifactsExcept(indexDir, null);
            log.info("Built empty vector index {}", buildId);
            return new VectorIndex(buildId, null, chunks);
        }
        SimpleVectorStore store = SimpleVectorStore.builder(embeddingModel).build();
        List<Document> documents = chunks.stream()
                .map(c -> Document.builder().id(c.chunkId()).text(c.text()).build())
                .toList();
        store.add(documents);

        Path artifact = artifactPath(indexDir, buildId);
        try {
            Files.createDirectories(indexDir);
            Path tmp = Files.createTempFile(indexDir, "." + buildId, ".tmp");
            try {
                store.save(tmp.toFile());
                AtomicFiles.move(tmp, artifact);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("Unable to save vector index " + artifact + ": " + e.getMessage(), e);
        }
        deleteArtifactsExcept(indexDir, artifact);
        log.info("Built vector index {} ({} chunks)", buildId, chunks.size());
        return new VectorIndex(buildId, store, chunks);
    }

    static Path artifactPath(Path indexDir, String buildId) {
        return indexDir.resolve(buildId + ".json");
    }

    private void deleteArtifactsExcept(Path indexDir, Path keep) {
        if (!Files.isDirectory(indexDir)) return;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(indexDir, "*.json")) {
            for (Path p : stream) {
                if (!p.equals(keep)) {
                    Files.deleteIfExists(p);
                    log.debug("Removed stale index artifact {}", p.getFileName());
                }
            }
        } catch (IOException e) {
            log.warn("Unable to remove stale index artifacts in {}: {}", indexDir, e.getMessage());
        }
    }
}
