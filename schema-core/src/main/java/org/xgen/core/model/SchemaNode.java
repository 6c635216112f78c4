package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A parsed declaration from a schema document.
 *
 * <p>The variant set is closed; callers branch on {@link #kind()} rather than
 * on the runtime class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SimpleType.class, name = "simpleType"),
    @JsonSubTypes.Type(value = ComplexType.class, name = "complexType"),
    @JsonSubTypes.Type(value = Element.class, name = "element"),
    @JsonSubTypes.Type(value = Attribute.class, name = "attribute"),
    @JsonSubTypes.Type(value = Group.class, name = "group"),
    @JsonSubTypes.Type(value = AttributeGroup.class, name = "attributeGroup")
})
public sealed interface SchemaNode
    permits SimpleType, ComplexType, Element, Attribute, Group, AttributeGroup {

  NodeKind kind();

  /** Schema-local name, possibly namespace-qualified ({@code "ns:Foo"}). */
  String name();

  /** Documentation text from {@code xs:annotation}, or {@code null}. */
  String doc();
}
