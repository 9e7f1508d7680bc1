package com.declparser.json;

import com.declparser.ast.Node;

/**
 * Writes syntax trees as JSON. Every node object carries a {@code "type"} member naming
 * its record, e.g. {@code "FieldsNamed"} or {@code "VisRestricted"}.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and everything below it, tokens included.
     *
     * @param node the node to serialize
     * @return compact JSON
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @param node the node to serialize
     * @return indented JSON
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
