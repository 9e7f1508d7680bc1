package com.declparser.ast;

/**
 * The type of a field. Only the shapes needed to delimit and reprint field types are modeled.
 */
public sealed interface Type extends Node, GenericArgument permits
    TypePath,
    TypeReference,
    TypePtr,
    TypeTuple,
    TypeSlice,
    TypeArray,
    TypeNever,
    TypeInfer {
}
