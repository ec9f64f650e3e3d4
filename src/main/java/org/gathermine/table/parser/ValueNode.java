package org.gathermine.table.parser;

/**
 * A value on the right-hand side of an assignment or field: a table constructor or a scalar.
 */
public interface ValueNode {

    /**
     * @return the line the value starts on
     */
    int line();
}
