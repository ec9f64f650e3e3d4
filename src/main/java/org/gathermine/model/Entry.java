package org.gathermine.model;

/**
 * A placed record inside a zone table.
 *
 * @param packedCoordinate The packed coordinate after collision resolution.
 * @param sourceId         The addon id of the node type.
 */
public record Entry(
        long packedCoordinate,
        String sourceId
) implements Comparable<Entry> {

    @Override
    public int compareTo(Entry other) {
        return Long.compare(packedCoordinate, other.packedCoordinate);
    }
}
