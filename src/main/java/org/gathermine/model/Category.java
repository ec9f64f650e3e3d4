package org.gathermine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The record categories the addon keeps in separate tables.
 */
public enum Category {
    /** Herbalism nodes. */
    HERBS("herbs", "Herb", "Mined_HerbalismData.lua"),
    /** Mining nodes. */
    ORES("ores", "Mine", "Mined_MiningData.lua"),
    /** Fishing pools. */
    FISH("fish", "Fish", "Mined_FishData.lua"),
    /** Treasures and other lootable objects. */
    TREASURES("treasures", "Treasure", "Mined_TreasureData.lua");

    private final String key;
    private final String tableLabel;
    private final String outputFileName;

    Category(String key, String tableLabel, String outputFileName) {
        this.key = key;
        this.tableLabel = tableLabel;
        this.outputFileName = outputFileName;
    }

    /**
     * The short name used in feeds and in cache keys, e.g. {@code herbs}.
     * @return the category key
     */
    public String key() {
        return key;
    }

    /**
     * The label the addon uses inside table names, e.g. {@code Mine}.
     * @return the table label
     */
    public String tableLabel() {
        return tableLabel;
    }

    /**
     * The file name of the primary table file written for this category.
     * @return the output file name
     */
    public String outputFileName() {
        return outputFileName;
    }

    /**
     * Builds the persisted table name, e.g. {@code GatherMate2HerbDB}.
     * @param prefix the addon prefix
     * @return the table name
     */
    public String tableName(String prefix) {
        return prefix + tableLabel + "DB";
    }

    /**
     * Looks a category up by its key.
     * @param key the category key, case-insensitive
     * @return the category, or empty if the key is unknown
     */
    public static Optional<Category> fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equalsIgnoreCase(key))
                .findFirst();
    }

    /**
     * Looks a category up by its persisted table name.
     * @param prefix the addon prefix
     * @param tableName the table name
     * @return the category, or empty if the name belongs to no category
     */
    public static Optional<Category> fromTableName(String prefix, String tableName) {
        return Arrays.stream(values())
                .filter(c -> c.tableName(prefix).equals(tableName))
                .findFirst();
    }
}
