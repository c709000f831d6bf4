package com.postintel.parser.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * One unit of work: a single social-media post.
 *
 * @param id        post id as given by the source (may be synthesised from the line number)
 * @param text      raw post text, never blank
 * @param timestamp creation time, null when the source did not carry one
 * @param hints     optional hints from an earlier pass
 * @param raw       the input record, passed through untouched to the output
 */
public record Post(String id, String text, Instant timestamp, PostHints hints, ObjectNode raw) {

    public Post {
        hints = hints == null ? PostHints.none() : hints;
    }

    public static Post of(String id, String text) {
        return new Post(id, text, null, PostHints.none(), null);
    }
}
