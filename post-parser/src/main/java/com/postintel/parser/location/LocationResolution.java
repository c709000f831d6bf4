package com.postintel.parser.location;

import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;

import java.util.List;

/**
 * Outcome of the whole tier chain for one post. Unresolved is a normal outcome:
 * location is null, confidence 0, source NONE.
 */
public record LocationResolution(
        ResolvedLocation location,
        double confidence,
        LocationSource source,
        Double dictionaryAgreement,
        Double semanticAgreement,
        List<String> trace
) {

    public LocationResolution {
        trace = List.copyOf(trace);
    }

    public static LocationResolution unresolved(List<String> trace) {
        return new LocationResolution(null, 0.0, LocationSource.NONE, null, null, trace);
    }

    public boolean isResolved() {
        return location != null;
    }
}
