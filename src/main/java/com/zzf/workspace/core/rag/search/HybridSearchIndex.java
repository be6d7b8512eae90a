package com.zzf.workspace.core.rag.search;

import com.zzf.workspace.core.rag.search.ScoreNormalizer.ScoredPath;
import com.zzf.workspace.core.rag.vector.EmbeddingService;
import com.zzf.workspace.core.rag.vector.VectorMatch;
import com.zzf.workspace.core.rag.vector.VectorStore;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process BM25 index blended with a delegated vector index.
 * <p>
 * Maintained incrementally: the document set, per-term document frequency and
 * per-document token length. Term frequencies are recomputed from the raw content on
 * every search. Re-upserting a path first withdraws the previous content's terms, so
 * repeated upserts of the same document leave the statistics unchanged.
 * <p>
 * Lexical state is guarded by a read/write lock. Embedding calls run outside it; the
 * vector write and the lexical commit run together under the write lock. A search
 * racing an upsert sees either the old or the new document.
 */
public final class HybridSearchIndex implements SearchIndex {
    private static final Logger logger = LoggerFactory.getLogger(HybridSearchIndex.class);
    private static final int HYBRID_LEXICAL_POOL_FACTOR = 3;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final SearchTokenizer tokenizer = new SearchTokenizer();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, IndexedDocument> docs = new LinkedHashMap<>();
    private final Map<String, Integer> docFrequency = new HashMap<>();
    private final Map<String, Integer> docLength = new HashMap<>();
    private double avgDocLength;

    public HybridSearchIndex(EmbeddingService embeddingService, VectorStore vectorStore) {
        if (embeddingService == null || vectorStore == null) {
            throw new IllegalArgumentException("embeddingService and vectorStore are required");
        }
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
    }

    @Override
    public void upsert(IndexedDocument document) {
        if (document == null || document.getPath() == null || document.getPath().isBlank()) {
            throw new InvalidToolArgumentsException("document path is required");
        }
        String path = document.getPath();
        String content = document.getContent() == null ? "" : document.getContent();
        String source = document.getSource() == null || document.getSource().isBlank()
                ? IndexedDocument.SOURCE_FILESYSTEM
                : document.getSource();
        IndexedDocument stored = new IndexedDocument(path, content, source);
        List<String> tokens = tokenizer.tokenize(content);

        // blank documents are kept lexically but never embedded; anything else is, even without lexical terms
        float[] vector = content.isBlank() ? null : embeddingService.embed(content);

        lock.writeLock().lock();
        try {
            if (vector != null) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("path", path);
                metadata.put("source", source);
                vectorStore.store(path, vector, metadata);
            } else {
                vectorStore.delete(path);
            }
            IndexedDocument previous = docs.put(path, stored);
            if (previous != null) {
                for (String term : distinct(tokenizer.tokenize(previous.getContent()))) {
                    docFrequency.computeIfPresent(term, (k, v) -> v <= 1 ? null : v - 1);
                }
            }
            for (String term : distinct(tokens)) {
                docFrequency.merge(term, 1, Integer::sum);
            }
            docLength.put(path, tokens.size());
            long total = 0L;
            for (int len : docLength.values()) {
                total += len;
            }
            avgDocLength = docLength.isEmpty() ? 0.0 : (double) total / docLength.size();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("search.upsert path={} source={} tokens={} embedded={}", path, source, tokens.size(), vector != null);
    }

    @Override
    public List<SearchHit> search(String query, SearchOptions options) {
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        if (query == null || query.isBlank() || size() == 0) {
            return Collections.emptyList();
        }
        int topK = Math.max(1, opts.getTopK());
        double vectorWeight = opts.getVectorWeight();
        if (vectorWeight < 0.0 || vectorWeight > 1.0) {
            throw new InvalidToolArgumentsException("vector_weight must be within [0, 1]");
        }
        long t0 = System.nanoTime();

        List<ScoredPath> lexical = searchBm25(tokenizer.tokenize(query));
        List<Ranked> ranked = new ArrayList<>();
        switch (opts.getMode()) {
            case BM25:
                for (ScoredPath r : head(lexical, topK)) {
                    ranked.add(new Ranked(r.path, r.score, r.score, null));
                }
                break;
            case VECTOR:
                for (ScoredPath r : searchVector(query, topK)) {
                    ranked.add(new Ranked(r.path, r.score, null, r.score));
                }
                break;
            case HYBRID:
            default:
                ranked = blend(head(lexical, topK * HYBRID_LEXICAL_POOL_FACTOR), searchVector(query, topK), vectorWeight, topK);
                break;
        }

        List<SearchHit> hits = new ArrayList<>();
        for (Ranked r : ranked) {
            if (r.score < opts.getMinScore()) {
                continue;
            }
            String content = get(r.path).map(IndexedDocument::getContent).orElse("");
            SnippetExtractor.Snippet snippet = SnippetExtractor.extract(content, query, opts.getSnippetLength());
            hits.add(SearchHit.builder()
                    .path(r.path)
                    .score(r.score)
                    .bm25Score(r.bm25)
                    .vectorScore(r.vector)
                    .content(content)
                    .snippet(snippet.getText())
                    .startLine(snippet.getStartLine())
                    .endLine(snippet.getEndLine())
                    .build());
        }
        logger.info("search.done mode={} topK={} hits={} tookMs={}", opts.getMode().wireName(), topK, hits.size(), (System.nanoTime() - t0) / 1_000_000L);
        return hits;
    }

    @Override
    public Optional<IndexedDocument> get(String path) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(docs.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return docs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    int documentFrequency(String term) {
        lock.readLock().lock();
        try {
            return docFrequency.getOrDefault(term, 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    double averageDocumentLength() {
        lock.readLock().lock();
        try {
            return avgDocLength;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ScoredPath> searchBm25(List<String> queryTokens) {
        if (queryTokens.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoredPath> results = new ArrayList<>();
        lock.readLock().lock();
        try {
            int n = docs.size();
            for (IndexedDocument doc : docs.values()) {
                List<String> docTokens = tokenizer.tokenize(doc.getContent());
                Map<String, Integer> tf = new HashMap<>();
                for (String t : docTokens) {
                    tf.merge(t, 1, Integer::sum);
                }
                double score = 0.0;
                for (String q : queryTokens) {
                    int f = tf.getOrDefault(q, 0);
                    if (f == 0) {
                        continue;
                    }
                    score += Bm25Scorer.termScore(f, docFrequency.getOrDefault(q, 0), n, docTokens.size(), avgDocLength);
                }
                if (score > 0) {
                    results.add(new ScoredPath(doc.getPath(), score));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        results.sort((a, b) -> Double.compare(b.score, a.score));
        return ScoreNormalizer.normalize(results);
    }

    private List<ScoredPath> searchVector(String query, int topK) {
        float[] qv = embeddingService.embed(query);
        List<VectorMatch> matches = vectorStore.search(qv, topK);
        List<ScoredPath> results = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (VectorMatch m : matches) {
                if (docs.containsKey(m.getId())) {
                    results.add(new ScoredPath(m.getId(), m.getScore()));
                } else {
                    logger.debug("search.vector.skip id={} reason=unknown_document", m.getId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return ScoreNormalizer.normalize(results);
    }

    private static List<Ranked> blend(List<ScoredPath> lexical, List<ScoredPath> vector, double vectorWeight, int topK) {
        Map<String, Double[]> combined = new LinkedHashMap<>();
        for (ScoredPath r : lexical) {
            combined.computeIfAbsent(r.path, k -> new Double[2])[0] = r.score;
        }
        for (ScoredPath r : vector) {
            combined.computeIfAbsent(r.path, k -> new Double[2])[1] = r.score;
        }
        List<Ranked> out = new ArrayList<>();
        for (Map.Entry<String, Double[]> e : combined.entrySet()) {
            Double bm25 = e.getValue()[0];
            Double vec = e.getValue()[1];
            double score = vectorWeight * (vec == null ? 0.0 : vec) + (1.0 - vectorWeight) * (bm25 == null ? 0.0 : bm25);
            out.add(new Ranked(e.getKey(), score, bm25, vec));
        }
        out.sort((a, b) -> Double.compare(b.score, a.score));
        return head(out, topK);
    }

    private static <T> List<T> head(List<T> list, int n) {
        return list.size() <= n ? list : new ArrayList<>(list.subList(0, n));
    }

    private static Set<String> distinct(List<String> tokens) {
        return new LinkedHashSet<>(tokens);
    }

    private static final class Ranked {
        private final String path;
        private final double score;
        private final Double bm25;
        private final Double vector;

        private Ranked(String path, double score, Double bm25, Double vector) {
            this.path = path;
            this.score = score;
            this.bm25 = bm25;
            this.vector = vector;
        }
    }
}
