package org.xgen.core;

import org.xgen.core.model.SimpleType;

import java.util.Map;

/**
 * Outcome of {@link TypeResolver#resolve}.
 */
public sealed interface ResolvedType {

  /** The name the resolution started from, or the name it settled on. */
  String name();

  /** A built-in type with its spelling in the requested language. */
  record Primitive(String name, String spelling) implements ResolvedType {}

  /** A simple type whose facets (pattern, enumeration, length) must be kept. */
  record Restricted(SimpleType simpleType) implements ResolvedType {
    @Override
    public String name() {
      return simpleType.name();
    }
  }

  record ListOf(SimpleType simpleType, String itemType) implements ResolvedType {
    @Override
    public String name() {
      return simpleType.name();
    }
  }

  record UnionOf(SimpleType simpleType, Map<String, String> memberTypes) implements ResolvedType {
    @Override
    public String name() {
      return simpleType.name();
    }
  }

  /** A structural declaration (complex type, group, attribute group) or a one-level alias target. */
  record Reference(String name) implements ResolvedType {}

  /** Nothing matched. The name is echoed back verbatim; this is not an error. */
  record Unresolved(String name) implements ResolvedType {}
}
