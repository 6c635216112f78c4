package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Ordered sequence of parsed schema nodes. Read-only once built, so one
 * document can feed several generation runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaDocument(String targetNamespace, List<SchemaNode> nodes) {

  public SchemaDocument {
    if (nodes == null) {
      throw new IllegalArgumentException("nodes is required");
    }
    nodes = List.copyOf(nodes);
  }

  public static SchemaDocument of(List<SchemaNode> nodes) {
    return new SchemaDocument(null, nodes);
  }
}
