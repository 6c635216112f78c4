package org.xgen.core.model;

/**
 * Discriminant of the {@link SchemaNode} variants.
 *
 * <p>{@link #hookName()} is the suffix used to build per-language hook names,
 * e.g. {@code "Java" + SIMPLE_TYPE.hookName()} is {@code "JavaSimpleType"}.
 */
public enum NodeKind {
  SIMPLE_TYPE("SimpleType"),
  COMPLEX_TYPE("ComplexType"),
  ELEMENT("Element"),
  ATTRIBUTE("Attribute"),
  GROUP("Group"),
  ATTRIBUTE_GROUP("AttributeGroup");

  private final String hookName;

  NodeKind(String hookName) {
    this.hookName = hookName;
  }

  public String hookName() {
    return hookName;
  }
}
