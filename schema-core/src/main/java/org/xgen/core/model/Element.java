package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An {@code xs:element} declaration, either top-level or inside a complex type or group.
 *
 * @param plural   maxOccurs greater than one
 * @param optional minOccurs of zero
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Element(
    String name,
    String doc,
    String type,
    boolean plural,
    boolean optional
) implements SchemaNode {

  public static Element of(String name, String type) {
    return new Element(name, null, type, false, false);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ELEMENT;
  }
}
