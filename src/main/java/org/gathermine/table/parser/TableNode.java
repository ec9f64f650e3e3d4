package org.gathermine.table.parser;

import java.util.List;

/**
 * A table constructor {@code { field, field, ... }}.
 *
 * @param fields The fields in source order.
 * @param line The line of the opening brace.
 */
public record TableNode(
        List<FieldNode> fields,
        int line
) implements ValueNode {
    public TableNode {
        fields = List.copyOf(fields);
    }
}
