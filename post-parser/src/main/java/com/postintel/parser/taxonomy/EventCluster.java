package com.postintel.parser.taxonomy;

import com.postintel.parser.model.EventCategory;

import java.util.List;

/**
 * Keyword cluster for one event category. Keywords are stored script-folded.
 *
 * @param weight category weight applied to the summed tier scores
 * @param strong defining terms, e.g. "उद्घाटन" for inauguration
 * @param medium supporting terms
 * @param weak   generic terms that only tip the balance
 */
public record EventCluster(
        EventCategory category,
        double weight,
        List<String> strong,
        List<String> medium,
        List<String> weak
) {

    public EventCluster {
        strong = List.copyOf(strong);
        medium = List.copyOf(medium);
        weak = List.copyOf(weak);
    }

    public boolean isEmpty() {
        return strong.isEmpty() && medium.isEmpty() && weak.isEmpty();
    }
}
