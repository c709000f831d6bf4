package com.postintel.parser.location;

import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.model.LocationSource;
import com.postintel.parser.model.ResolvedLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns gazetteer records into per-post {@link ResolvedLocation}s.
 *
 * Canonical keys look like CG_DISTRICT_रायपुर or CG_ULB_भिलाई: state code, type tag, canonical name.
 */
public final class ResolvedLocations {

    private ResolvedLocations() {
    }

    public static ResolvedLocation from(GazetteerRecord record, LocationSource source,
                                        double confidence, String stateCode) {
        ResolvedLocation.ResolvedLocationBuilder builder = ResolvedLocation.builder()
                .canonical(record.canonical())
                .locationType(record.type())
                .hierarchyPath(record.hierarchyPath())
                .district(record.district())
                .assembly(record.assembly())
                .block(record.block())
                .gramPanchayat(record.gramPanchayat())
                .canonicalKey(canonicalKey(record, stateCode))
                .source(source)
                .confidence(confidence);

        switch (record.type()) {
            case VILLAGE -> builder.village(record.canonical());
            case URBAN_LOCAL_BODY -> builder.urbanBody(record.canonical());
            default -> { }
        }
        return builder.build();
    }

    /** Attaches ward and zone numbers, extending the hierarchy path below the urban body. */
    public static ResolvedLocation withWardZone(ResolvedLocation location, WardZoneExtractor.WardZone wardZone) {
        if (wardZone == null || wardZone.isEmpty()) return location;

        List<String> path = new ArrayList<>(location.hierarchyPath());
        if (wardZone.zone() != null) path.add("जोन " + wardZone.zone());
        if (wardZone.ward() != null) path.add("वार्ड " + wardZone.ward());

        return location.toBuilder()
                .ward(wardZone.ward())
                .zone(wardZone.zone())
                .hierarchyPath(path)
                .build();
    }

    public static String canonicalKey(GazetteerRecord record, String stateCode) {
        return stateCode + "_" + record.type().keyTag() + "_" + record.canonical();
    }
}
