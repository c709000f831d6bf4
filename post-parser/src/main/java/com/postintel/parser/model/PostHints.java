package com.postintel.parser.model;

import java.util.List;

/**
 * Optional hints carried over from an earlier pass over the same post.
 *
 * @param handles      pre-extracted account handles (without '@')
 * @param locationHint a place name suggested upstream, tried as an extra candidate
 */
public record PostHints(List<String> handles, String locationHint) {

    public PostHints {
        handles = handles == null ? List.of() : List.copyOf(handles);
    }

    public static PostHints none() {
        return new PostHints(List.of(), null);
    }
}
