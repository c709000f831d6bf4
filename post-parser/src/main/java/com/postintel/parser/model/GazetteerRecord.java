package com.postintel.parser.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.stream.Stream;

/**
 * One administrative unit from the reference datasets.
 *
 * Invariants:
 *  - hierarchyPath starts at the state root and ends with this record's own label,
 *    so every non-state record has exactly one path to the root
 *  - aliases (script variants, transliterations, English spellings) all map onto
 *    this single canonical record
 */
@Builder(toBuilder = true)
public record GazetteerRecord(
        String canonical,
        @Singular List<String> aliases,
        AdminType type,
        List<String> hierarchyPath,
        String district,
        String assembly,
        String block,
        String gramPanchayat,
        String urbanBodyType,
        Integer wardCount
) {

    public GazetteerRecord {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        hierarchyPath = hierarchyPath == null ? List.of() : List.copyOf(hierarchyPath);
    }

    public int depth() {
        return hierarchyPath.size();
    }

    /** Every name this record answers to, canonical first. */
    public List<String> allNames() {
        return Stream.concat(Stream.of(canonical), aliases.stream())
                .filter(n -> n != null && !n.isBlank())
                .distinct()
                .toList();
    }
}
