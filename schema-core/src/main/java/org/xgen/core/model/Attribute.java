package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Attribute(
    String name,
    String doc,
    String type,
    boolean optional,
    @JsonAlias({"default"}) String defaultValue
) implements SchemaNode {

  public static Attribute of(String name, String type) {
    return new Attribute(name, null, type, false, null);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ATTRIBUTE;
  }
}
