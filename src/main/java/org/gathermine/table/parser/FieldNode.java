package org.gathermine.table.parser;

/**
 * One field of a table constructor.
 *
 * @param key The key: the bracketed expression, a {@link ScalarNode} for {@code name = value}
 *            fields, or {@code null} for positional fields.
 * @param value The field value.
 * @param line The line the field starts on.
 */
public record FieldNode(
        ValueNode key,
        ValueNode value,
        int line
) {
}
