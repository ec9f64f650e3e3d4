package org.gathermine.merge;

import org.gathermine.model.Category;
import org.gathermine.table.TableData;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The content of a SavedVariables file: the addon settings, any other top-level sections,
 * and one table per category.
 * <p>
 * The settings block and the other sections are opaque text that is carried through unchanged.
 * So is a category section that could not be parsed, until new data for its category replaces it.
 * Tables are copied on the way in and out, so a document never changes after construction.
 */
public final class PersistedDocument {

    private final String settingsBlock;
    private final List<String> otherSections;
    private final Map<Category, TableData> tables;
    private final Map<Category, String> unreadableTables;

    /**
     * Creates a document without unreadable category sections.
     *
     * @param settingsBlock the verbatim settings section, e.g. {@code GatherMate2DB = { ... }}
     * @param otherSections verbatim top-level sections that are neither settings nor a category, in source order
     * @param tables the category tables; empty tables are dropped
     */
    public PersistedDocument(String settingsBlock, List<String> otherSections, Map<Category, TableData> tables) {
        this(settingsBlock, otherSections, tables, Map.of());
    }

    /**
     * Creates a document.
     *
     * @param settingsBlock the verbatim settings section, e.g. {@code GatherMate2DB = { ... }}
     * @param otherSections verbatim top-level sections that are neither settings nor a category, in source order
     * @param tables the category tables; empty tables are dropped
     * @param unreadableTables verbatim text of category sections that could not be parsed; a category
     *                         that also has a non-empty table keeps only the table
     */
    public PersistedDocument(String settingsBlock, List<String> otherSections, Map<Category, TableData> tables,
                             Map<Category, String> unreadableTables) {
        this.settingsBlock = Objects.requireNonNull(settingsBlock, "settingsBlock");
        this.otherSections = List.copyOf(otherSections);
        Map<Category, TableData> copy = new EnumMap<>(Category.class);
        tables.forEach((category, data) -> {
            if (!data.isEmpty()) {
                copy.put(category, data.copy());
            }
        });
        Map<Category, String> unreadable = new EnumMap<>(Category.class);
        unreadableTables.forEach((category, text) -> {
            if (!copy.containsKey(category)) {
                unreadable.put(category, text);
            }
        });
        this.tables = Collections.unmodifiableMap(copy);
        this.unreadableTables = Collections.unmodifiableMap(unreadable);
    }

    public String settingsBlock() {
        return settingsBlock;
    }

    public List<String> otherSections() {
        return otherSections;
    }

    /**
     * @return the non-empty category tables in category order
     */
    public Map<Category, TableData> tables() {
        return tables;
    }

    /**
     * @return the verbatim text of category sections that could not be parsed, in category order
     */
    public Map<Category, String> unreadableTables() {
        return unreadableTables;
    }

    /**
     * @param category the category
     * @return a copy of the category's table, empty if the document has none or it is unreadable
     */
    public TableData table(Category category) {
        TableData data = tables.get(category);
        return data == null ? new TableData() : data.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedDocument)) return false;
        PersistedDocument that = (PersistedDocument) o;
        return settingsBlock.equals(that.settingsBlock)
                && otherSections.equals(that.otherSections)
                && tables.equals(that.tables)
                && unreadableTables.equals(that.unreadableTables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(settingsBlock, otherSections, tables, unreadableTables);
    }
}
