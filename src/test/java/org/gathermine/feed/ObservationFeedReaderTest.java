package org.gathermine.feed;

import org.gathermine.junit.extensions.logging.ExpectLog;
import org.gathermine.junit.extensions.logging.LogLevel;
import org.gathermine.junit.extensions.logging.LogWatchExtension;
import org.gathermine.model.Category;
import org.gathermine.model.SourceObject;
import org.gathermine.model.Zone;
import org.gathermine.zone.ZoneRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ObservationFeedReaderTest {

    private final ObservationFeedReader reader = new ObservationFeedReader(new ZoneRegistry(
            Map.of("331", new Zone("331", "63", "Ashenvale")), Set.of("718")));

    @Test
    void readsObjectsInFeedOrder(@TempDir Path tempDir) throws Exception {
        Path feed = tempDir.resolve("feed.json");
        Files.writeString(feed, "{\"objects\": ["
                + "{\"name\": \"Peacebloom\", \"sourceId\": \"401\", \"category\": \"herbs\", \"partition\": \"classic\","
                + " \"observations\": [{\"zone\": \"331\", \"x\": 10.0, \"y\": 20.0}, {\"zone\": 331, \"x\": 10, \"y\": 20}]},"
                + "{\"name\": \"Copper Vein\", \"sourceId\": \"201\", \"category\": \"ores\", \"partition\": \"classic\","
                + " \"observations\": []}"
                + "]}", StandardCharsets.UTF_8);

        List<SourceObject> objects = reader.read(feed);

        assertThat(objects).extracting(SourceObject::name).containsExactly("Peacebloom", "Copper Vein");
        SourceObject peacebloom = objects.get(0);
        assertThat(peacebloom.category()).isEqualTo(Category.HERBS);
        assertThat(peacebloom.partition()).isEqualTo("classic");
        assertThat(peacebloom.observations()).hasSize(2).allSatisfy(observation -> {
            assertThat(observation.zone().canonicalId()).isEqualTo("63");
            assertThat(observation.x()).isEqualTo(10.0);
            assertThat(observation.y()).isEqualTo(20.0);
            assertThat(observation.sourceId()).isEqualTo("401");
        });
        assertThat(objects.get(1).observations()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Found unlisted zone 9999 for Peacebloom, skipping observation")
    void unlistedZoneIsDroppedWithWarning() throws Exception {
        List<SourceObject> objects = read(object("herbs", "{\"zone\": \"9999\", \"x\": 1, \"y\": 2}, {\"zone\": \"331\", \"x\": 1, \"y\": 2}"));

        assertThat(objects.get(0).observations()).hasSize(1);
    }

    @Test
    void suppressedZoneIsDroppedSilently() throws Exception {
        List<SourceObject> objects = read(object("herbs", "{\"zone\": \"718\", \"x\": 1, \"y\": 2}"));

        assertThat(objects.get(0).observations()).isEmpty();
    }

    @Test
    void unknownCategoryIsRejected() {
        assertThatThrownBy(() -> read(object("gems", "")))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("unknown category 'gems'");
    }

    @Test
    void missingFieldIsRejected() {
        String feed = "{\"objects\": [{\"name\": \"Peacebloom\", \"category\": \"herbs\", \"partition\": \"classic\", \"observations\": []}]}";

        assertThatThrownBy(() -> read(feed))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("objects[0]")
                .hasMessageContaining("sourceId");
    }

    @Test
    void nonNumericSourceIdIsRejected() {
        String feed = "{\"objects\": [{\"name\": \"Peacebloom\", \"sourceId\": \"abc\", \"category\": \"herbs\","
                + " \"partition\": \"classic\", \"observations\": []}]}";

        assertThatThrownBy(() -> read(feed))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("objects[0]")
                .hasMessageContaining("sourceId 'abc' is not a decimal integer");
    }

    @Test
    void partitionThatCannotNameACacheFileIsRejected() {
        String feed = "{\"objects\": [{\"name\": \"Peacebloom\", \"sourceId\": \"401\", \"category\": \"herbs\","
                + " \"partition\": \"The War Within\", \"observations\": []}]}";

        assertThatThrownBy(() -> read(feed))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("partition 'The War Within'");
    }

    @Test
    void nonNumericCoordinateIsRejected() {
        assertThatThrownBy(() -> read(object("herbs", "{\"zone\": \"331\", \"x\": \"ten\", \"y\": 2}")))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("'x' must be a number");
    }

    @Test
    void feedWithoutObjectsArrayIsRejected() {
        assertThatThrownBy(() -> read("{\"items\": []}"))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("no 'objects' array");
    }

    @Test
    void invalidJsonIsRejected() {
        assertThatThrownBy(() -> read("{\"objects\": ["))
                .isInstanceOf(FeedFormatException.class)
                .hasMessageContaining("not valid JSON");
    }

    private List<SourceObject> read(String json) throws IOException, FeedFormatException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "feed.json");
    }

    private static String object(String category, String observations) {
        return "{\"objects\": [{\"name\": \"Peacebloom\", \"sourceId\": \"401\", \"category\": \"" + category + "\","
                + " \"partition\": \"classic\", \"observations\": [" + observations + "]}]}";
    }
}
