package org.gathermine.merge;

import org.gathermine.model.Category;
import org.gathermine.table.TableData;

import java.util.EnumMap;
import java.util.Map;

/**
 * Merges freshly aggregated tables into a persisted document.
 * <p>
 * The merge is a union: a new source id replaces the one stored at the same zone and coordinate,
 * every other stored coordinate is kept. Nothing is ever removed, so a node that disappeared
 * upstream stays in the document. A category section that could not be parsed is kept verbatim
 * unless new data for its category is merged, which then starts the category afresh.
 */
public final class MergeEngine {

    private MergeEngine() {
    }

    /**
     * Merges new tables into a document.
     *
     * @param existing the document read from disk
     * @param newTables the new tables per category; categories not in the map are passed through
     * @return the merged document; {@code existing} is left unchanged
     */
    public static PersistedDocument merge(PersistedDocument existing, Map<Category, TableData> newTables) {
        Map<Category, TableData> merged = new EnumMap<>(Category.class);
        merged.putAll(existing.tables());
        newTables.forEach((category, fresh) -> {
            TableData table = existing.table(category);
            table.putAll(fresh);
            merged.put(category, table);
        });
        return new PersistedDocument(existing.settingsBlock(), existing.otherSections(), merged,
                existing.unreadableTables());
    }
}
