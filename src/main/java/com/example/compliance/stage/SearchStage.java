package com.example.compliance.stage;

import com.example.compliance.exception.IngestionException;
import com.example.compliance.exception.InvalidationException;
import com.example.compliance.exception.ProviderException;
import com.example.compliance.model.AuditTask;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.DocumentRecord;
import com.example.compliance.model.MatchResult;
import com.example.compliance.model.NormDoc;
import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProcedureChunk;
import com.example.compliance.model.RawDoc;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.RunState;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.service.CachedEmbeddingModel;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.DocumentChunker;
import com.example.compliance.service.DocumentIngestionService;
import com.example.compliance.service.DocumentNormalizer;
import com.example.compliance.service.EmbeddingService;
import com.example.compliance.service.VectorIndex;
import com.example.compliance.service.VectorIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ingests the procedure corpus, keeps the vector index in step with it and retrieves the
 * top-K chunks for every audit task that has no results for the current build.
 * <p>
 * Invalidation: the index is rebuilt whenever a document fingerprint (content hash, modification
 * time, ingestion outcome) differs from the run state or the saved artifact is missing or
 * unreadable. A new build id drops every task's matches and sends searched and judged clauses
 * back to PLANNED. Chunk embeddings come from the content cache, so a rebuild only embeds
 * chunks whose text is new.
 */
@Service
public class SearchStage implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(SearchStage.class);

    static final String INDEX_DIR = "index";

    private final DocumentIngestionService ingestionService;
    private final DocumentNormalizer normalizer;
    private final DocumentChunker chunker;
    private final VectorIndexService indexService;
    private final EmbeddingService embeddingService;
    private final ContentCache cache;

    public SearchStage(DocumentIngestionService ingestionService,
                       DocumentNormalizer normalizer,
                       DocumentChunker chunker,
                       VectorIndexService indexService,
                       EmbeddingService embeddingService,
                       ContentCache cache) {
        this.ingestionService = ingestionService;
        this.normalizer = normalizer;
        this.chunker = chunker;
        this.indexService = indexService;
        this.embeddingService = embeddingService;
        this.cache = cache;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.SEARCH;
    }

    @Override
    public void execute(RunContext context) {
        PipelineSettings settings = context.settings();
        RunState state = context.store().snapshot();
        if (state.clauses().values().stream().noneMatch(SearchStage::awaitsRetrieval)) {
            log.info("Search: no planned clause, corpus not indexed");
            context.progress(stage(), 0).note("SKIPPED", "No audit task to search");
            return;
        }

        // ── (a) ingest, normalize, chunk ──
        Corpus corpus = buildCorpus(context);
        CachedEmbeddingModel embeddingModel =
                new CachedEmbeddingModel(embeddingService, cache, settings.embeddingModel(), settings.retryPolicy());
        String buildId = VectorIndexService.buildId(settings.embeddingModel(), corpus.chunks());

        // ── (b) invalidation check ──
        boolean documentsChanged = !corpus.documents().equals(state.documents());
        boolean buildChanged = !buildId.equals(state.indexBuildId());
        if (documentsChanged) {
            log.info("Search: procedure documents changed since the last run, index will be rebuilt");
        }

        // ── (c) build or load the index ──
        Path indexDir = context.workDir().resolve(INDEX_DIR);
        Optional<VectorIndex> loaded = Optional.empty();
        if (!documentsChanged) {
            try {
                loaded = indexService.load(indexDir, buildId, corpus.chunks(), embeddingModel);
            } catch (InvalidationException e) {
                log.warn("Search: {}, rebuilding", e.getMessage());
            }
        }
        VectorIndex index;
        if (loaded.isPresent()) {
            index = loaded.get();
        } else {
            try {
                if (!prewarm(context, corpus.chunks(), embeddingModel)) {
                    log.info("Search: cancelled while embedding the corpus");
                    return;
                }
                index = indexService.build(indexDir, buildId, corpus.chunks(), embeddingModel);
            } catch (ProviderException e) {
                String error = AbstractLlmStage.errorMessage("Index build", e);
                log.error("Search: {}", error);
                for (RegulationClause clause : context.store().snapshot().clauses().values()) {
                    if (awaitsRetrieval(clause)) {
                        context.store().updateClause(clause.id(), c -> c.backToPlanned().failed(error));
                    }
                }
                return;
            }
        }

        if (buildChanged && state.indexBuildId() != null) {
            log.info("Search: index build changed ({} -> {}), previous matches invalidated",
                    state.indexBuildId(), buildId);
        }
        context.store().update(s -> {
            RunState updated = s.withIndex(corpus.documents(), buildId);
            return buildChanged ? updated.mapClauses(RegulationClause::backToPlanned) : updated;
        });

        // ── (d) retrieve for tasks without current results ──
        search(context, index);
    }

    private Corpus buildCorpus(RunContext context) {
        List<Path> paths = context.project().procedurePaths().stream()
                .map(Path::of)
                .sorted()
                .toList();
        RunContext.StageProgress progress = context.progress(stage(), paths.size());
        DocumentIngestionService.Result ingested = ingestionService.ingest(paths);

        Map<String, DocumentRecord> documents = new LinkedHashMap<>();
        List<ProcedureChunk> chunks = new ArrayList<>();
        for (RawDoc raw : ingested.documents()) {
            NormDoc norm = normalizer.normalize(raw);
            List<ProcedureChunk> docChunks = chunker.chunk(norm, context.settings().maxChunkTokens(), chunks.size());
            chunks.addAll(docChunks);
            documents.put(raw.path(), DocumentRecord.ingested(raw, docChunks.size()));
            progress.note("INGESTED", raw.path() + ": " + docChunks.size() + " chunk(s)");
        }
        for (IngestionException failure : ingested.failures()) {
            documents.put(failure.getPath(), DocumentRecord.failed(failure.getPath(), failure.getMessage()));
            progress.note("INGESTION_FAILED", failure.getPath() + ": " + failure.getMessage());
        }
        Map<String, DocumentRecord> ordered = new LinkedHashMap<>();
        documents.keySet().stream().sorted().forEach(k -> ordered.put(k, documents.get(k)));
        log.info("Search: {} document(s) ingested, {} failed, {} chunk(s)",
                ingested.documents().size(), ingested.failures().size(), chunks.size());
        return new Corpus(ordered, chunks);
    }

    /** Embeds every chunk through the cache on the worker pool. False if cancelled. */
    private boolean prewarm(RunContext context, List<ProcedureChunk> chunks, CachedEmbeddingModel model) {
        context.forEach(chunks, chunk -> model.embed(chunk.text()));
        return !context.cancelled();
    }

    private void search(RunContext context, VectorIndex index) {
        int k = context.settings().topK();
        String buildId = index.buildId();

        // clauses whose matches came from another build or K start over from PLANNED
        for (RegulationClause clause : context.store().snapshot().clauses().values()) {
            boolean searchedState = clause.status() == ClauseStatus.SEARCHED || clause.status() == ClauseStatus.JUDGED;
            if (searchedState && !clause.allTasksSearchedWith(buildId, k)) {
                context.store().updateClause(clause.id(), RegulationClause::backToPlanned);
            }
        }

        List<RegulationClause> planned = context.store().snapshot().clausesIn(ClauseStatus.PLANNED);
        List<TaskRef> work = new ArrayList<>();
        for (RegulationClause clause : planned) {
            for (AuditTask task : clause.tasks()) {
                if (!task.searchedWith(buildId, k)) {
                    work.add(new TaskRef(clause.id(), task));
                }
            }
        }
        log.info("Search: {} task(s) to retrieve over {} chunk(s), K={}", work.size(), index.size(), k);
        RunContext.StageProgress progress = context.progress(stage(), work.size());

        Map<String, String> failures = new ConcurrentHashMap<>();
        context.forEach(work, ref -> {
            if (failures.containsKey(ref.clauseId())) return;
            try {
                List<MatchResult> matches = index.query(ref.task().sentence(), k).stream()
                        .map(MatchResult::of)
                        .toList();
                context.store().updateTask(ref.clauseId(), ref.task().id(), t -> t.withMatches(matches, buildId, k));
                progress.step(ref.clauseId(), ref.task().id(), "SEARCHED", matches.size() + " match(es)");
            } catch (ProviderException e) {
                String error = AbstractLlmStage.errorMessage("Search", e);
                log.error("Search {}: {}", ref.task().id(), error);
                failures.put(ref.clauseId(), error);
                progress.step(ref.clauseId(), ref.task().id(), ClauseStatus.FAILED.name(), error);
            }
        });

        for (RegulationClause clause : planned) {
            String error = failures.get(clause.id());
            if (error != null) {
                context.store().updateClause(clause.id(), c -> c.failed(error));
            } else if (context.store().snapshot().clause(clause.id()).allTasksSearchedWith(buildId, k)) {
                context.store().updateClause(clause.id(), c -> c.withStatus(ClauseStatus.SEARCHED));
            }
        }
    }

    /** Clauses whose results depend on the index: planned, searched or judged. */
    private static boolean awaitsRetrieval(RegulationClause clause) {
        return clause.status() == ClauseStatus.PLANNED
                || clause.status() == ClauseStatus.SEARCHED
                || clause.status() == ClauseStatus.JUDGED;
    }

    private record Corpus(Map<String, DocumentRecord> documents, List<ProcedureChunk> chunks) {
    }

    private record TaskRef(String clauseId, AuditTask task) {
    }
}
