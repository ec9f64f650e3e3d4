package org.gathermine.model;

/**
 * One scraped point of a source object inside a zone.
 *
 * @param zone     The zone the point lies in.
 * @param x        The horizontal map position in percent, expected in [0,100].
 * @param y        The vertical map position in percent, expected in [0,100].
 * @param sourceId The addon id of the node type that was observed.
 */
public record RawObservation(
        Zone zone,
        double x,
        double y,
        String sourceId
) {
}
