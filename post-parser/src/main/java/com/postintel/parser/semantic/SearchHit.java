package com.postintel.parser.semantic;

/**
 * One nearest-neighbour hit: a gazetteer place name and its similarity in [0,1].
 */
public record SearchHit(String name, double score) {
}
