package com.postintel.parser.semantic;

import java.util.List;

/** Used when semantic search is switched off. Every call reports the backend unavailable. */
public class DisabledLocationSearchClient implements LocationSearchClient {

    @Override
    public List<SearchHit> search(String query, int k, double minScore) {
        throw new SemanticBackendUnavailableException("Semantic search is disabled");
    }
}
