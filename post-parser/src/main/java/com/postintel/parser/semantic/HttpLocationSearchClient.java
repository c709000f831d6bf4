package com.postintel.parser.semantic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

/**
 * Client for a remote embedding + nearest-neighbour service.
 *
 * Contract: GET {baseUrl}/search?q=..&k=..&min_score=..
 * returns a JSON array of {"name": "...", "score": 0.87}, best first.
 *
 * Transient failures are retried by Resilience4j ("locationSearch" instance);
 * anything still failing surfaces as SemanticBackendUnavailableException.
 */
@Slf4j
public class HttpLocationSearchClient implements LocationSearchClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpLocationSearchClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    @Retry(name = "locationSearch")
    public List<SearchHit> search(String query, int k, double minScore) {
        URI url = UriComponentsBuilder
                .fromHttpUrl(baseUrl + "/search")
                .queryParam("q", query)
                .queryParam("k", k)
                .queryParam("min_score", minScore)
                .build()
                .encode()
                .toUri();

        log.debug("Calling location search: {}", url);
        try {
            HitResponse[] response = restTemplate.getForObject(url, HitResponse[].class);
            if (response == null) return List.of();
            return Arrays.stream(response)
                    .filter(h -> h.name() != null && h.score() >= minScore)
                    .map(h -> new SearchHit(h.name(), h.score()))
                    .limit(Math.max(1, k))
                    .toList();
        } catch (RestClientException e) {
            throw new SemanticBackendUnavailableException("Location search failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HitResponse(String name, double score) {}
}
