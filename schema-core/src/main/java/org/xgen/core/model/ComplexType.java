package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * An {@code xs:complexType} declaration.
 *
 * <p>{@code groups} and {@code attributeGroups} hold the names of referenced
 * {@link Group} and {@link AttributeGroup} declarations.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplexType(
    String name,
    String doc,
    String base,
    boolean mixed,
    List<Element> elements,
    List<Attribute> attributes,
    List<String> groups,
    List<String> attributeGroups
) implements SchemaNode {

  public ComplexType {
    elements = elements == null ? List.of() : List.copyOf(elements);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
    groups = groups == null ? List.of() : List.copyOf(groups);
    attributeGroups = attributeGroups == null ? List.of() : List.copyOf(attributeGroups);
  }

  public static ComplexType of(String name, List<Element> elements, List<Attribute> attributes) {
    return new ComplexType(name, null, null, false, elements, attributes, null, null);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.COMPLEX_TYPE;
  }
}
