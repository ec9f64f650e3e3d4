package org.gathermine.table;

/**
 * Thrown when the section of a category table is present in a document but cannot be parsed.
 */
public class TableFormatException extends Exception {

    private final String tableName;
    private final int line;

    /**
     * Constructs the exception.
     * @param tableName The name of the malformed table.
     * @param line The line the problem was found on.
     * @param message The detail message.
     */
    public TableFormatException(String tableName, int line, String message) {
        super(String.format("%s (line %d): %s", tableName, line, message));
        this.tableName = tableName;
        this.line = line;
    }

    public String getTableName() {
        return tableName;
    }

    public int getLine() {
        return line;
    }
}
