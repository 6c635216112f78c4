package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** A named {@code xs:attributeGroup}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttributeGroup(
    String name,
    String doc,
    List<Attribute> attributes
) implements SchemaNode {

  public AttributeGroup {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ATTRIBUTE_GROUP;
  }
}
