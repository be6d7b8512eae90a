package com.zzf.workspace.core.rag.search;

import java.util.List;
import java.util.Optional;

/**
 * Searchable document store keyed by workspace path.
 */
public interface SearchIndex {

    /**
     * Adds or replaces the document under its path. Either every structure is updated or
     * the call throws and the previous state stays visible.
     */
    void upsert(IndexedDocument document);

    List<SearchHit> search(String query, SearchOptions options);

    Optional<IndexedDocument> get(String path);

    int size();
}
