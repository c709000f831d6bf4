package com.postintel.parser.semantic;

import java.util.List;

/**
 * Nearest-neighbour search over place names.
 */
public interface LocationSearchClient {

    /**
     * @param query    free text, typically a marker-adjacent candidate span
     * @param k        maximum number of hits
     * @param minScore hits below this similarity are dropped
     * @return hits ordered by descending score, possibly empty
     * @throws SemanticBackendUnavailableException when the backend cannot answer
     */
    List<SearchHit> search(String query, int k, double minScore);
}
