package org.gathermine.merge;

import org.gathermine.model.Category;
import org.gathermine.table.TableData;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MergeEngineTest {

    private static final String SETTINGS = "GatherMate2DB = {\n\t[\"profiles\"] = {\n\t},\n}";

    @Test
    void mergeWithNothingNewKeepsTheDocument() {
        PersistedDocument existing = document(Map.of(Category.HERBS, table("63", "1000200000", "401")));

        PersistedDocument merged = MergeEngine.merge(existing, Map.of());

        assertThat(merged).isEqualTo(existing);
    }

    @Test
    void newSourceIdReplacesStoredOne() {
        PersistedDocument existing = document(Map.of(Category.HERBS, table("63", "1000200000", "401")));

        PersistedDocument merged = MergeEngine.merge(existing, Map.of(Category.HERBS, table("63", "1000200000", "405")));

        assertThat(merged.table(Category.HERBS).get("63", "1000200000")).isEqualTo("405");
        assertThat(merged.table(Category.HERBS).size()).isEqualTo(1);
    }

    @Test
    void storedCoordinatesAndZonesSurvive() {
        TableData stored = table("63", "1000200000", "401");
        stored.put("10", "5000500000", "402");
        PersistedDocument existing = document(Map.of(Category.HERBS, stored));

        PersistedDocument merged = MergeEngine.merge(existing, Map.of(Category.HERBS, table("63", "2000300000", "403")));

        TableData herbs = merged.table(Category.HERBS);
        assertThat(herbs.zones()).containsOnlyKeys("10", "63");
        assertThat(herbs.coordinates("63")).containsOnlyKeys("1000200000", "2000300000");
        assertThat(herbs.get("10", "5000500000")).isEqualTo("402");
    }

    @Test
    void categoriesWithoutNewDataPassThrough() {
        PersistedDocument existing = document(Map.of(
                Category.HERBS, table("63", "1000200000", "401"),
                Category.FISH, table("1", "100020000", "601")));

        PersistedDocument merged = MergeEngine.merge(existing, Map.of(Category.ORES, table("63", "1000200000", "201")));

        assertThat(merged.tables()).containsOnlyKeys(Category.HERBS, Category.ORES, Category.FISH);
        assertThat(merged.table(Category.FISH)).isEqualTo(existing.table(Category.FISH));
        assertThat(merged.table(Category.HERBS).get("63", "1000200000")).isEqualTo("401");
    }

    @Test
    void settingsAndOtherSectionsAreCarried() {
        PersistedDocument existing = new PersistedDocument(SETTINGS, List.of("Other = { 1 }"), Map.of());

        PersistedDocument merged = MergeEngine.merge(existing, Map.of(Category.TREASURES, table("63", "1", "701")));

        assertThat(merged.settingsBlock()).isEqualTo(SETTINGS);
        assertThat(merged.otherSections()).containsExactly("Other = { 1 }");
    }

    @Test
    void mergeDoesNotModifyTheExistingDocumentOrTheInput() {
        TableData fresh = table("63", "1000200000", "405");
        PersistedDocument existing = document(Map.of(Category.HERBS, table("63", "1000200000", "401")));

        MergeEngine.merge(existing, Map.of(Category.HERBS, fresh));

        assertThat(existing.table(Category.HERBS).get("63", "1000200000")).isEqualTo("401");
        assertThat(fresh.size()).isEqualTo(1);
    }

    private static PersistedDocument document(Map<Category, TableData> tables) {
        return new PersistedDocument(SETTINGS, List.of(), tables);
    }

    private static TableData table(String zone, String coordinate, String sourceId) {
        TableData data = new TableData();
        data.put(zone, coordinate, sourceId);
        return data;
    }
}
