package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Administrative level of a gazetteer record.
 *
 * The suffix is appended to names when building display hierarchy paths,
 * e.g. "रायपुर" + " जिला".
 */
public enum AdminType {

    STATE("state", ""),
    DISTRICT("district", " जिला"),
    ASSEMBLY_CONSTITUENCY("assembly_constituency", " विधानसभा"),
    BLOCK("block", " विकासखंड"),
    GRAM_PANCHAYAT("gram_panchayat", " पंचायत"),
    VILLAGE("village", ""),
    URBAN_LOCAL_BODY("urban_local_body", "");

    private final String code;
    private final String pathSuffix;

    AdminType(String code, String pathSuffix) {
        this.code = code;
        this.pathSuffix = pathSuffix;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String pathLabel(String name) {
        return name + pathSuffix;
    }

    /** Short upper-case tag used in canonical keys, e.g. CG_VILLAGE_सिलतरा */
    public String keyTag() {
        return switch (this) {
            case URBAN_LOCAL_BODY -> "ULB";
            case ASSEMBLY_CONSTITUENCY -> "AC";
            case GRAM_PANCHAYAT -> "GP";
            default -> name();
        };
    }

    public boolean isUrban() {
        return this == URBAN_LOCAL_BODY;
    }

    public boolean isRural() {
        return this == VILLAGE || this == GRAM_PANCHAYAT || this == BLOCK;
    }
}
