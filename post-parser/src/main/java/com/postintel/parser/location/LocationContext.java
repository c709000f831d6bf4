package com.postintel.parser.location;

import com.postintel.parser.model.Post;

import java.util.List;

/**
 * Everything the tiers need about one post, computed once by the resolver.
 *
 * @param normalized lower-cased NFC text without URLs
 * @param folded     script-folded form of normalized
 */
public record LocationContext(
        Post post,
        String cleaned,
        String normalized,
        String folded,
        List<Candidate> candidates,
        AreaContext area,
        LocationWindow window
) {

    public LocationContext {
        candidates = List.copyOf(candidates);
    }
}
