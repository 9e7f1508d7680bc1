package com.declparser.ast;

/**
 * Visibility qualifier of a field or item.
 */
public sealed interface Visibility extends Node permits
    VisPublic,
    VisCrate,
    VisRestricted,
    VisInherited {
}
