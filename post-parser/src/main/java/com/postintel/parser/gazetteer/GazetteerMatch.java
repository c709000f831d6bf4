package com.postintel.parser.gazetteer;

import com.postintel.parser.model.GazetteerRecord;

/**
 * A gazetteer hit for one candidate string.
 *
 * @param exact true when the candidate's surface form (lower-cased) was itself an indexed
 *              name; false when only a folded or transliterated variant matched
 */
public record GazetteerMatch(GazetteerRecord record, String surface, boolean exact) {
}
