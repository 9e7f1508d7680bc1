package com.declparser.json;

import com.declparser.ast.Node;
import com.declparser.ast.Variant;

/**
 * Reads syntax trees back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a single enum variant.
     *
     * @param json the JSON string to deserialize
     * @return the variant
     * @throws AstJsonException if the JSON is malformed or does not describe a variant
     */
    Variant deserializeVariant(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type; may be a sealed supertype such as {@code Fields}
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
