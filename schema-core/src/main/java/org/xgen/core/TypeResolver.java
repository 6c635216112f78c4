package org.xgen.core;

import org.xgen.core.model.Attribute;
import org.xgen.core.model.Element;
import org.xgen.core.model.NodeKind;
import org.xgen.core.model.SchemaDocument;
import org.xgen.core.model.SchemaNode;
import org.xgen.core.model.SimpleType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves declared type names against the nodes of one schema document.
 *
 * <p>Every lookup is a linear scan in document order and the first matching
 * node wins. No index is built: documents are small and each name is
 * resolved once per call site. Alias chains are flattened by exactly one
 * level per call; callers needing more call again until the result is
 * built-in or stops changing.
 */
public final class TypeResolver {

  private final List<SchemaNode> nodes;

  public TypeResolver(List<SchemaNode> nodes) {
    this.nodes = List.copyOf(nodes);
  }

  public TypeResolver(SchemaDocument document) {
    this(document.nodes());
  }

  /**
   * Flatten one level of aliasing for {@code name}.
   *
   * <ul>
   *   <li>a simple type carrying pattern, enumeration or length facets resolves to its own name;</li>
   *   <li>a simple type that is neither list nor union resolves to its base;</li>
   *   <li>an attribute or element resolves to its declared type;</li>
   *   <li>anything else resolves to {@code name} unchanged.</li>
   * </ul>
   */
  public String resolveBaseOfSimpleType(String name) {
    for (SchemaNode node : nodes) {
      switch (node.kind()) {
        case SIMPLE_TYPE -> {
          SimpleType simpleType = (SimpleType) node;
          if (simpleType.restriction().hasConstraints() && Objects.equals(simpleType.name(), name)) {
            return simpleType.name();
          }
          if (!simpleType.list() && !simpleType.union() && Objects.equals(simpleType.name(), name)) {
            return simpleType.base() == null ? "" : simpleType.base();
          }
        }
        case ATTRIBUTE -> {
          if (Objects.equals(node.name(), name)) {
            return ((Attribute) node).type();
          }
        }
        case ELEMENT -> {
          if (Objects.equals(node.name(), name)) {
            return ((Element) node).type();
          }
        }
        default -> {
          // complex types, groups and attribute groups never alias
        }
      }
    }
    return name;
  }

  /**
   * Find the simple type named {@code name} that is neither a list nor a union,
   * for callers that need its restriction facets.
   */
  public Optional<SimpleType> resolveSimpleTypeNode(String name) {
    for (SchemaNode node : nodes) {
      if (node.kind() == NodeKind.SIMPLE_TYPE) {
        SimpleType simpleType = (SimpleType) node;
        if (!simpleType.list() && !simpleType.union() && Objects.equals(simpleType.name(), name)) {
          return Optional.of(simpleType);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Resolve {@code name} into a {@link ResolvedType} for {@code language}.
   * Built-in names win; then list, union and constrained simple types; then
   * one level of aliasing; then structural declarations. A name nothing
   * matches comes back as {@link ResolvedType.Unresolved}.
   */
  public ResolvedType resolve(String name, Language language) {
    Optional<String> builtIn = BuiltInTypes.lookup(name, language);
    if (builtIn.isPresent()) {
      return new ResolvedType.Primitive(name, builtIn.get());
    }
    String local = QualifiedNames.trimNsPrefix(name);
    builtIn = BuiltInTypes.lookup(local, language);
    if (builtIn.isPresent()) {
      return new ResolvedType.Primitive(local, builtIn.get());
    }

    Optional<SimpleType> declared = findSimpleType(local);
    if (declared.isPresent()) {
      SimpleType simpleType = declared.get();
      if (simpleType.list()) {
        return new ResolvedType.ListOf(simpleType, simpleType.base());
      }
      if (simpleType.union()) {
        return new ResolvedType.UnionOf(simpleType, simpleType.memberTypes());
      }
      if (simpleType.restriction().hasConstraints()) {
        return new ResolvedType.Restricted(simpleType);
      }
    }

    String base = resolveBaseOfSimpleType(local);
    if (base != null && !base.isEmpty() && !base.equals(local)) {
      String baseLocal = QualifiedNames.trimNsPrefix(base);
      Optional<String> baseBuiltIn = BuiltInTypes.lookup(base, language);
      if (baseBuiltIn.isPresent()) {
        return new ResolvedType.Primitive(base, baseBuiltIn.get());
      }
      baseBuiltIn = BuiltInTypes.lookup(baseLocal, language);
      if (baseBuiltIn.isPresent()) {
        return new ResolvedType.Primitive(baseLocal, baseBuiltIn.get());
      }
      return new ResolvedType.Reference(baseLocal);
    }

    if (isStructural(local)) {
      return new ResolvedType.Reference(local);
    }
    return new ResolvedType.Unresolved(name);
  }

  private Optional<SimpleType> findSimpleType(String name) {
    for (SchemaNode node : nodes) {
      if (node.kind() == NodeKind.SIMPLE_TYPE && Objects.equals(node.name(), name)) {
        return Optional.of((SimpleType) node);
      }
    }
    return Optional.empty();
  }

  private boolean isStructural(String name) {
    for (SchemaNode node : nodes) {
      switch (node.kind()) {
        case COMPLEX_TYPE, GROUP, ATTRIBUTE_GROUP -> {
          if (Objects.equals(node.name(), name)) {
            return true;
          }
        }
        default -> {
        }
      }
    }
    return false;
  }
}
