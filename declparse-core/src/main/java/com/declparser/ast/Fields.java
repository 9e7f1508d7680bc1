package com.declparser.ast;

import java.util.List;

/**
 * Data stored within an enum variant or struct.
 */
public sealed interface Fields extends Node permits
    FieldsNamed,
    FieldsUnnamed,
    FieldsUnit {

    /**
     * The fields in declaration order; empty for unit.
     */
    List<Field> members();
}
