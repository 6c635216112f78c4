package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * An {@code xs:simpleType} declaration.
 *
 * <p>For a list type {@code base} holds the item type. For a union type
 * {@code memberTypes} maps each member's name to its type; the mapping has no
 * meaningful order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimpleType(
    String name,
    String doc,
    String base,
    boolean list,
    boolean union,
    Map<String, String> memberTypes,
    Restriction restriction
) implements SchemaNode {

  public SimpleType {
    memberTypes = memberTypes == null ? Map.of() : Map.copyOf(memberTypes);
    restriction = restriction == null ? Restriction.NONE : restriction;
  }

  public static SimpleType alias(String name, String base) {
    return new SimpleType(name, null, base, false, false, null, Restriction.NONE);
  }

  public static SimpleType restricted(String name, String base, Restriction restriction) {
    return new SimpleType(name, null, base, false, false, null, restriction);
  }

  public static SimpleType enumeration(String name, String base, List<String> values) {
    return restricted(name, base, Restriction.ofEnumeration(values));
  }

  public static SimpleType listOf(String name, String itemType) {
    return new SimpleType(name, null, itemType, true, false, null, Restriction.NONE);
  }

  public static SimpleType unionOf(String name, Map<String, String> memberTypes) {
    return new SimpleType(name, null, null, false, true, memberTypes, Restriction.NONE);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SIMPLE_TYPE;
  }
}
