package com.declparser.parsing;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The node kinds {@link DeclParser#parse(NodeKind, String)} can start from, by command-line name.
 */
public enum NodeKind {
    VARIANT("variant"),
    VARIANTS("variants"),
    FIELDS("fields"),
    FIELD("field"),
    UNNAMED_FIELD("unnamed-field"),
    VISIBILITY("visibility"),
    TYPE("type"),
    EXPR("expr"),
    PATH("path");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NodeKind fromLabel(String label) {
        for (NodeKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown kind '" + label + "', expected one of " + labels());
    }

    public static String labels() {
        return Arrays.stream(values()).map(NodeKind::label).collect(Collectors.joining("|"));
    }
}
