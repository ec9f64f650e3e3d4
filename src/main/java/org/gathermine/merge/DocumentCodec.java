package org.gathermine.merge;

import org.gathermine.diagnostics.Diagnostic;
import org.gathermine.diagnostics.DiagnosticsEngine;
import org.gathermine.model.Category;
import org.gathermine.table.TableData;
import org.gathermine.table.TableFormatException;
import org.gathermine.table.TableSerializer;
import org.gathermine.table.parser.Section;
import org.gathermine.table.parser.TableParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and renders SavedVariables documents for one addon prefix.
 * <p>
 * Reading favors availability: a category section that cannot be parsed is logged and carried
 * through verbatim. It is only replaced when a merge brings new data for its category, which then
 * behaves like a first write.
 */
public class DocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(DocumentCodec.class);

    private final String prefix;

    /**
     * @param prefix the addon prefix, e.g. {@code GatherMate2}
     */
    public DocumentCodec(String prefix) {
        this.prefix = prefix;
    }

    /**
     * @return the name of the settings section, e.g. {@code GatherMate2DB}
     */
    public String settingsName() {
        return prefix + "DB";
    }

    /**
     * @return a document holding nothing but an empty settings section
     */
    public PersistedDocument empty() {
        return new PersistedDocument(emptySettings(), List.of(), Map.of());
    }

    /**
     * Reads a document.
     *
     * @param text the file content
     * @param sourceName the file name, for log output
     * @return the document
     */
    public PersistedDocument read(String text, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Map<String, Section> sections = TableParser.parseDocument(text, diagnostics);

        String settings = emptySettings();
        List<String> others = new ArrayList<>();
        Map<Category, TableData> tables = new EnumMap<>(Category.class);
        Map<Category, String> unreadable = new EnumMap<>(Category.class);

        for (Section section : sections.values()) {
            if (section.name().equals(settingsName())) {
                if (section.isMalformed()) {
                    log.warn("Settings section {} in {} could not be parsed, carrying it through unchanged", section.name(), sourceName);
                }
                settings = section.sourceText(text);
                continue;
            }
            Optional<Category> category = Category.fromTableName(prefix, section.name());
            if (category.isEmpty()) {
                others.add(section.sourceText(text));
                continue;
            }
            Optional<TableData> table = readTable(category.get(), section, diagnostics, sourceName);
            if (table.isPresent()) {
                tables.put(category.get(), table.get());
                unreadable.remove(category.get());
            } else {
                tables.remove(category.get());
                unreadable.put(category.get(), section.sourceText(text));
            }
        }

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.type() == Diagnostic.Type.ERROR && !sections.containsKey(diagnostic.section())) {
                log.warn("Ignoring unreadable content in {}: {}", sourceName, diagnostic);
            }
        }
        return new PersistedDocument(settings, others, tables, unreadable);
    }

    private Optional<TableData> readTable(Category category, Section section, DiagnosticsEngine diagnostics, String sourceName) {
        try {
            TableData data = TableSerializer.extract(section, diagnostics);
            int skipped = 0;
            for (Diagnostic diagnostic : diagnostics.forSection(section.name())) {
                if (diagnostic.type() == Diagnostic.Type.WARNING) {
                    log.debug("{}: {}", sourceName, diagnostic);
                    skipped++;
                }
            }
            if (skipped > 0) {
                log.warn("Skipped {} unrecognized fields in {} table {} of {}", skipped, category.key(), section.name(), sourceName);
            }
            return Optional.of(data);
        } catch (TableFormatException e) {
            log.warn("Could not parse {} table in {}, carrying it through unchanged until new {} data replaces it: {}",
                    category.key(), sourceName, category.key(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Renders a document: settings first, then the other sections, then every category in
     * category order, either as its table or as the verbatim text of an unreadable section.
     *
     * @param document the document
     * @return the file content
     */
    public String render(PersistedDocument document) {
        StringBuilder out = new StringBuilder();
        out.append(document.settingsBlock()).append("\n\n");
        for (String section : document.otherSections()) {
            out.append(section).append("\n\n");
        }
        for (Category category : Category.values()) {
            TableData table = document.tables().get(category);
            if (table != null) {
                out.append(TableSerializer.serialize(table, category.tableName(prefix))).append('\n');
            } else if (document.unreadableTables().containsKey(category)) {
                out.append(document.unreadableTables().get(category)).append('\n');
            }
        }
        return out.toString();
    }

    private String emptySettings() {
        return settingsName() + " = {\n}";
    }
}
