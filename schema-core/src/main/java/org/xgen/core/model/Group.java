package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** A named {@code xs:group} of elements. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    String name,
    String doc,
    boolean plural,
    List<Element> elements
) implements SchemaNode {

  public Group {
    elements = elements == null ? List.of() : List.copyOf(elements);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.GROUP;
  }
}
