package com.declparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic handling for node hierarchies: the concrete record is named by a
 * {@code "type"} property holding its simple class name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public interface NodeMixin {
}
