package com.declparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DeclparseJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(variant);
 * Variant variant = mapper.readValue(json, Variant.class);
 * </pre>
 */
public final class DeclparseJackson {

    private DeclparseJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic node types via the "type" property
     * - Leaves out null components (absent tokens and optional children)
     * - Writes the empty records VisInherited and FieldsUnit as just their type
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional parts are null in the tree and omitted in JSON
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
