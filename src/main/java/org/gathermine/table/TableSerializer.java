package org.gathermine.table;

import org.gathermine.diagnostics.Diagnostic;
import org.gathermine.diagnostics.DiagnosticsEngine;
import org.gathermine.model.CategoryTable;
import org.gathermine.model.Zone;
import org.gathermine.table.parser.FieldNode;
import org.gathermine.table.parser.ScalarNode;
import org.gathermine.table.parser.Section;
import org.gathermine.table.parser.TableNode;
import org.gathermine.table.parser.TableParser;
import org.gathermine.table.parser.ValueNode;

import java.util.Map;
import java.util.NavigableMap;

/**
 * Writes category tables in the addon's nested table format and reads them back.
 * <pre>
 * GatherMate2HerbDB = {
 * 	[63] = {
 * 		[100020000] = 401,
 * 	},
 * }
 * </pre>
 * Zones and coordinates are always written in ascending numeric order so that files of two runs
 * differ only where the data differs.
 */
public final class TableSerializer {

    private TableSerializer() {
    }

    /**
     * Serializes an aggregated table.
     *
     * @param table the aggregated table
     * @param tableName the name to assign the table to, e.g. {@code GatherMate2HerbDB}
     * @return the table text, without a trailing newline
     */
    public static String serialize(CategoryTable table, String tableName) {
        return serialize(TableData.from(table), tableName);
    }

    /**
     * Serializes a structured table.
     *
     * @param data the table
     * @param tableName the name to assign the table to
     * @return the table text, without a trailing newline
     */
    public static String serialize(TableData data, String tableName) {
        StringBuilder out = new StringBuilder();
        out.append(tableName).append(" = {\n");
        for (Map.Entry<String, NavigableMap<String, String>> zone : data.zones().entrySet()) {
            out.append("\t[").append(zone.getKey()).append("] = {\n");
            for (Map.Entry<String, String> coordinate : zone.getValue().entrySet()) {
                out.append("\t\t[").append(coordinate.getKey()).append("] = ")
                        .append(coordinate.getValue()).append(",\n");
            }
            out.append("\t},\n");
        }
        out.append('}');
        return out.toString();
    }

    /**
     * Parses one category table out of a document. Other sections of the document are ignored,
     * even when they are malformed.
     *
     * @param text the document text
     * @param tableName the table to extract
     * @return the table, empty if the document has no section of that name
     * @throws TableFormatException if the section exists but is malformed
     */
    public static TableData parse(String text, String tableName) throws TableFormatException {
        return parse(text, tableName, new DiagnosticsEngine());
    }

    /**
     * Parses one category table out of a document, collecting warnings about skipped fields.
     *
     * @param text the document text
     * @param tableName the table to extract
     * @param diagnostics receives the diagnostics of the whole document
     * @return the table, empty if the document has no section of that name
     * @throws TableFormatException if the section exists but is malformed
     */
    public static TableData parse(String text, String tableName, DiagnosticsEngine diagnostics) throws TableFormatException {
        Section section = TableParser.parseDocument(text, diagnostics).get(tableName);
        if (section == null) {
            return new TableData();
        }
        return extract(section, diagnostics);
    }

    /**
     * Converts a parsed section into a table. Fields that are not numeric
     * {@code [zone] = { [coordinate] = id }} entries are skipped with a warning.
     *
     * @param section the parsed section
     * @param diagnostics receives warnings about skipped fields
     * @return the table
     * @throws TableFormatException if the section is malformed or not a table
     */
    public static TableData extract(Section section, DiagnosticsEngine diagnostics) throws TableFormatException {
        if (section.isMalformed()) {
            Diagnostic cause = diagnostics.forSection(section.name()).stream()
                    .filter(d -> d.type() == Diagnostic.Type.ERROR)
                    .findFirst()
                    .orElse(new Diagnostic(Diagnostic.Type.ERROR, "Malformed section", section.name(), section.line()));
            throw new TableFormatException(section.name(), cause.lineNumber(), cause.message());
        }
        if (!(section.value() instanceof TableNode root)) {
            throw new TableFormatException(section.name(), section.line(), "Expected a table");
        }

        TableData data = new TableData();
        for (FieldNode zoneField : root.fields()) {
            String zoneId = integerKey(zoneField.key());
            if (zoneId == null || !(zoneField.value() instanceof TableNode zoneTable)) {
                diagnostics.reportWarning("Skipping field that is not a [zone] = { ... } entry", section.name(), zoneField.line());
                continue;
            }
            for (FieldNode coordinateField : zoneTable.fields()) {
                String coordinate = integerKey(coordinateField.key());
                String sourceId = integerValue(coordinateField.value());
                if (coordinate == null || sourceId == null) {
                    diagnostics.reportWarning("Skipping field of zone " + zoneId + " that is not a [coordinate] = id entry",
                            section.name(), coordinateField.line());
                    continue;
                }
                data.put(zoneId, coordinate, sourceId);
            }
        }
        return data;
    }

    private static String integerKey(ValueNode key) {
        return integerValue(key);
    }

    private static String integerValue(ValueNode node) {
        if (node instanceof ScalarNode scalar && scalar.isNumber() && Zone.isNumeric(scalar.text())) {
            return TableData.canonical(scalar.text());
        }
        return null;
    }
}
