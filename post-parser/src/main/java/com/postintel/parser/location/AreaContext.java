package com.postintel.parser.location;

/** Whether a post's vocabulary reads as urban, rural or neither. */
public enum AreaContext {
    URBAN, RURAL, NONE
}
