package org.gathermine.model;

import java.util.List;

/**
 * A tracked source object together with everything observed for it.
 * <p>
 * The order of source objects in a run, and of observations inside one object, is the
 * registration order that makes collision resolution reproducible.
 *
 * @param name         Display name, used for log output only.
 * @param sourceId     The addon id written into the tables.
 * @param category     The table the object belongs to.
 * @param partition    The cache partition (expansion) the object is tracked in.
 * @param observations The observed points, in feed order.
 */
public record SourceObject(
        String name,
        String sourceId,
        Category category,
        String partition,
        List<RawObservation> observations
) {
    public SourceObject {
        observations = List.copyOf(observations);
    }
}
