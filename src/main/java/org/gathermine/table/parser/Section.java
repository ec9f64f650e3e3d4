package org.gathermine.table.parser;

/**
 * A top-level {@code name = value} assignment of a document.
 * <p>
 * The source span covers the assignment from its name to its last token and is used to carry
 * sections through a rewrite verbatim. A malformed section has no value.
 *
 * @param name The assigned name.
 * @param value The parsed value, or {@code null} if the section is malformed.
 * @param line The line of the name.
 * @param start The source offset of the name.
 * @param end The source offset after the last token of the section.
 */
public record Section(
        String name,
        ValueNode value,
        int line,
        int start,
        int end
) {
    /**
     * @return {@code true} if the section could not be parsed
     */
    public boolean isMalformed() {
        return value == null;
    }

    /**
     * @param source the document the section was parsed from
     * @return the line of the last token of the section
     */
    public int endLine(String source) {
        int lines = line;
        for (int i = start; i < end; i++) {
            if (source.charAt(i) == '\n') lines++;
        }
        return lines;
    }

    /**
     * Extracts the original text of this section.
     * @param source the document the section was parsed from
     * @return the verbatim section text
     */
    public String sourceText(String source) {
        return source.substring(start, end);
    }
}
