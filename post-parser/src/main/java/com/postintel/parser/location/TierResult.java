package com.postintel.parser.location;

import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;

/**
 * What a tier found, how sure it is and where it came from.
 *
 * @param matchedText         the text span that produced the match, null for inferred tiers
 * @param dictionaryAgreement share of gazetteer matches that agree with the winner, null if not computed
 * @param semanticScore       raw similarity of a semantic-search hit, null if not computed
 */
public record TierResult(
        ResolvedLocation location,
        LocationSource source,
        double confidence,
        String matchedText,
        Double dictionaryAgreement,
        Double semanticScore
) {

    public static TierResult of(ResolvedLocation location, String matchedText) {
        return new TierResult(location, location.source(), location.confidence(), matchedText, null, null);
    }
}
