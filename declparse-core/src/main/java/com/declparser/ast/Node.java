package com.declparser.ast;

/**
 * Base interface for all declaration syntax tree nodes.
 */
public sealed interface Node permits
    Variant,
    VariantList,
    Fields,
    Field,
    Visibility,
    Ident,
    Path,
    PathSegment,
    GenericArguments,
    Type,
    Lifetime,
    Expr,
    Attribute {

    /**
     * Node kind name, used as the discriminator when trees are serialized.
     */
    default String type() {
        return getClass().getSimpleName();
    }
}
