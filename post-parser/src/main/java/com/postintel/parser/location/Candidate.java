package com.postintel.parser.location;

/**
 * A span of post text that might name a place.
 *
 * @param markerAdjacent true when the span sits next to an administrative marker
 *                       ("जिला", "नगर निगम", "ग्राम") or a locative postposition ("में")
 */
public record Candidate(String surface, boolean markerAdjacent) {
}
