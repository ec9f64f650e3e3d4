package org.gathermine.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gathermine.cache.CacheSnapshotStore;
import org.gathermine.model.Category;
import org.gathermine.model.RawObservation;
import org.gathermine.model.SourceObject;
import org.gathermine.model.Zone;
import org.gathermine.zone.ZoneRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the JSON observation feed into source objects.
 * <pre>
 * { "objects": [ { "name": "Peacebloom", "sourceId": "401", "category": "herbs", "partition": "CL",
 *                  "observations": [ { "zone": "331", "x": 10.0, "y": 20.0 } ] } ] }
 * </pre>
 * Observations in zones the registry does not know are dropped: with a warning, unless the
 * zone is suppressed. Source ids must be decimal integers and partition keys must be usable in
 * a cache file name.
 */
public class ObservationFeedReader {

    private static final Logger log = LoggerFactory.getLogger(ObservationFeedReader.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ZoneRegistry zones;

    /**
     * @param zones the registry resolving feed zone ids
     */
    public ObservationFeedReader(ZoneRegistry zones) {
        this.zones = zones;
    }

    /**
     * Reads a feed file.
     *
     * @param file the feed file
     * @return the source objects in feed order
     * @throws IOException if the file cannot be read
     * @throws FeedFormatException if the content is not a valid feed
     */
    public List<SourceObject> read(Path file) throws IOException, FeedFormatException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.getFileName().toString());
        }
    }

    /**
     * Reads a feed.
     *
     * @param in the feed content
     * @param sourceName the feed name, for messages
     * @return the source objects in feed order
     * @throws IOException if the stream cannot be read
     * @throws FeedFormatException if the content is not a valid feed
     */
    public List<SourceObject> read(InputStream in, String sourceName) throws IOException, FeedFormatException {
        final JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new FeedFormatException(sourceName + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("objects").isArray()) {
            throw new FeedFormatException(sourceName + " has no 'objects' array");
        }

        List<SourceObject> objects = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.get("objects")) {
            objects.add(readObject(node, sourceName + " objects[" + index + "]"));
            index++;
        }
        log.info("Read {} source objects from {}", objects.size(), sourceName);
        return objects;
    }

    private SourceObject readObject(JsonNode node, String where) throws FeedFormatException {
        if (!node.isObject()) {
            throw new FeedFormatException(where + " is not an object");
        }
        String name = requireText(node, "name", where);
        String sourceId = requireText(node, "sourceId", where);
        if (!Zone.isNumeric(sourceId)) {
            throw new FeedFormatException(where + ": sourceId '" + sourceId + "' is not a decimal integer");
        }
        String categoryKey = requireText(node, "category", where);
        Category category = Category.fromKey(categoryKey)
                .orElseThrow(() -> new FeedFormatException(where + ": unknown category '" + categoryKey + "'"));
        String partition = requireText(node, "partition", where);
        if (!CacheSnapshotStore.isValidPartition(partition)) {
            throw new FeedFormatException(where + ": partition '" + partition
                    + "' may only contain letters, digits, '.', '_' and '-'");
        }

        JsonNode observationNodes = node.path("observations");
        if (!observationNodes.isArray()) {
            throw new FeedFormatException(where + ": missing 'observations' array");
        }

        List<RawObservation> observations = new ArrayList<>();
        int dropped = 0;
        for (JsonNode observation : observationNodes) {
            String zoneId = requireText(observation, "zone", where + " observation");
            double x = requireNumber(observation, "x", where);
            double y = requireNumber(observation, "y", where);

            Optional<Zone> zone = zones.resolve(zoneId);
            if (zone.isEmpty()) {
                if (zones.isSuppressed(zoneId)) {
                    log.debug("Skipping suppressed zone {} for {}", zoneId, name);
                } else {
                    log.warn("Found unlisted zone {} for {}, skipping observation", zoneId, name);
                }
                dropped++;
                continue;
            }
            observations.add(new RawObservation(zone.get(), x, y, sourceId));
        }
        if (dropped > 0) {
            log.debug("{}: dropped {} of {} observations", name, dropped, observationNodes.size());
        }
        return new SourceObject(name, sourceId, category, partition, observations);
    }

    private static String requireText(JsonNode node, String field, String where) throws FeedFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new FeedFormatException(where + ": missing field '" + field + "'");
        }
        return value.asText();
    }

    private static double requireNumber(JsonNode node, String field, String where) throws FeedFormatException {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new FeedFormatException(where + ": field '" + field + "' must be a number");
        }
        return value.asDouble();
    }
}
