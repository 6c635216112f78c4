package org.xgen.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xgen.core.model.Attribute;
import org.xgen.core.model.AttributeGroup;
import org.xgen.core.model.ComplexType;
import org.xgen.core.model.Element;
import org.xgen.core.model.Group;
import org.xgen.core.model.Restriction;
import org.xgen.core.model.SchemaNode;
import org.xgen.core.model.SimpleType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class TypeResolverTest {

  private List<SchemaNode> nodes;
  private TypeResolver resolver;

  @BeforeEach
  void setUp() {
    nodes = List.of(
        SimpleType.alias("Max35Text", "xs:string"),
        SimpleType.enumeration("Currency", "xs:string", List.of("EUR", "USD")),
        SimpleType.alias("PlainCode", "xs:string"),
        SimpleType.restricted("IBAN", "xs:string", Restriction.ofPattern("[A-Z]{2}[0-9]{2}[a-zA-Z0-9]{1,30}")),
        SimpleType.restricted("ShortText", "xs:string", new Restriction(null, null, 1, 10)),
        SimpleType.listOf("CodeList", "Currency"),
        SimpleType.unionOf("Amount", Map.of("Decimal", "xs:decimal", "Text", "Max35Text")),
        SimpleType.alias("AccountId", "IBAN"),
        ComplexType.of("Party", List.of(Element.of("Name", "Max35Text")), List.of()),
        Element.of("Document", "Party"),
        Attribute.of("lang", "xml:lang"),
        new Group("Address", null, false, List.of(Element.of("Street", "Max35Text"))),
        new AttributeGroup("Common", null, List.of(Attribute.of("id", "xs:ID")))
    );
    resolver = new TypeResolver(nodes);
  }

  @Test
  void shouldEchoUnknownNames() {
    assertThat(resolver.resolveBaseOfSimpleType("Unknown")).isEqualTo("Unknown");
    assertThat(new TypeResolver(List.of()).resolveBaseOfSimpleType("Unknown")).isEqualTo("Unknown");
  }

  @Test
  void shouldFlattenUnconstrainedAliasOneLevel() {
    assertThat(resolver.resolveBaseOfSimpleType("Max35Text")).isEqualTo("xs:string");
    // AccountId -> IBAN stops there even though IBAN has a base of its own
    assertThat(resolver.resolveBaseOfSimpleType("AccountId")).isEqualTo("IBAN");
  }

  @Test
  void constrainedSimpleTypeResolvesToItsOwnName() {
    assertThat(resolver.resolveBaseOfSimpleType("Currency")).isEqualTo("Currency");
    assertThat(resolver.resolveBaseOfSimpleType("PlainCode")).isEqualTo("xs:string");
    assertThat(resolver.resolveBaseOfSimpleType("IBAN")).isEqualTo("IBAN");
    assertThat(resolver.resolveBaseOfSimpleType("ShortText")).isEqualTo("ShortText");
  }

  @Test
  void shouldNotFlattenListsOrUnions() {
    assertThat(resolver.resolveBaseOfSimpleType("CodeList")).isEqualTo("CodeList");
    assertThat(resolver.resolveBaseOfSimpleType("Amount")).isEqualTo("Amount");
  }

  @Test
  void shouldResolveAttributesAndElementsToTheirType() {
    assertThat(resolver.resolveBaseOfSimpleType("Document")).isEqualTo("Party");
    assertThat(resolver.resolveBaseOfSimpleType("lang")).isEqualTo("xml:lang");
  }

  @Test
  void complexTypesAreNotAliases() {
    assertThat(resolver.resolveBaseOfSimpleType("Party")).isEqualTo("Party");
  }

  @Test
  void firstMatchingNodeWins() {
    TypeResolver shadowed = new TypeResolver(List.of(
        Element.of("Code", "xs:token"),
        SimpleType.alias("Code", "xs:string")
    ));
    assertThat(shadowed.resolveBaseOfSimpleType("Code")).isEqualTo("xs:token");

    TypeResolver listFirst = new TypeResolver(List.of(
        SimpleType.listOf("Code", "xs:int"),
        Attribute.of("Code", "xs:boolean")
    ));
    // the list node does not match, so the scan continues to the attribute
    assertThat(listFirst.resolveBaseOfSimpleType("Code")).isEqualTo("xs:boolean");
  }

  @Test
  void shouldFindSimpleTypeNodeWithFacets() {
    assertThat(resolver.resolveSimpleTypeNode("Currency"))
        .hasValueSatisfying(st -> assertThat(st.restriction().enumeration()).containsExactly("EUR", "USD"));
    assertThat(resolver.resolveSimpleTypeNode("ShortText"))
        .hasValueSatisfying(st -> {
          assertThat(st.restriction().hasMinLength()).isTrue();
          assertThat(st.restriction().maxLength()).isEqualTo(10);
        });
  }

  @Test
  void simpleTypeNodeLookupSkipsListsUnionsAndOtherKinds() {
    assertThat(resolver.resolveSimpleTypeNode("CodeList")).isEmpty();
    assertThat(resolver.resolveSimpleTypeNode("Amount")).isEmpty();
    assertThat(resolver.resolveSimpleTypeNode("Party")).isEmpty();
    assertThat(resolver.resolveSimpleTypeNode("Unknown")).isEmpty();
  }

  @Test
  void resolveReturnsPrimitiveForBuiltInNames() {
    assertThat(resolver.resolve("xs:decimal", Language.RUST))
        .isEqualTo(new ResolvedType.Primitive("decimal", "f64"));
    assertThat(resolver.resolve("xml:lang", Language.JAVA))
        .isEqualTo(new ResolvedType.Primitive("xml:lang", "String"));
  }

  @Test
  void resolveFlattensAliasToPrimitive() {
    assertThat(resolver.resolve("Max35Text", Language.GO))
        .isEqualTo(new ResolvedType.Primitive("string", "string"));
    assertThat(resolver.resolve("lang", Language.C))
        .isEqualTo(new ResolvedType.Primitive("xml:lang", "char"));
  }

  @Test
  void resolveKeepsConstrainedSimpleTypes() {
    assertThat(resolver.resolve("Currency", Language.JAVA))
        .isInstanceOfSatisfying(ResolvedType.Restricted.class,
            r -> assertThat(r.simpleType().name()).isEqualTo("Currency"));
    assertThat(resolver.resolve("ns:IBAN", Language.JAVA))
        .isInstanceOf(ResolvedType.Restricted.class);
  }

  @Test
  void resolveRecognisesListsAndUnions() {
    assertThat(resolver.resolve("CodeList", Language.TYPESCRIPT))
        .isInstanceOfSatisfying(ResolvedType.ListOf.class,
            l -> assertThat(l.itemType()).isEqualTo("Currency"));
    assertThat(resolver.resolve("Amount", Language.TYPESCRIPT))
        .isInstanceOfSatisfying(ResolvedType.UnionOf.class,
            u -> assertThat(u.memberTypes()).containsOnlyKeys("Decimal", "Text"));
  }

  @Test
  void resolveReturnsReferencesForStructuralTargets() {
    assertThat(resolver.resolve("Party", Language.JAVA)).isEqualTo(new ResolvedType.Reference("Party"));
    assertThat(resolver.resolve("Document", Language.JAVA)).isEqualTo(new ResolvedType.Reference("Party"));
    assertThat(resolver.resolve("AccountId", Language.JAVA)).isEqualTo(new ResolvedType.Reference("IBAN"));
    assertThat(resolver.resolve("Address", Language.JAVA)).isEqualTo(new ResolvedType.Reference("Address"));
    assertThat(resolver.resolve("Common", Language.JAVA)).isEqualTo(new ResolvedType.Reference("Common"));
  }

  @Test
  void resolveEchoesUnknownNamesVerbatim() {
    assertThat(resolver.resolve("ext:Unknown", Language.GO))
        .isEqualTo(new ResolvedType.Unresolved("ext:Unknown"));
  }

  @Test
  void resolveTreatsNullAsUnresolved() {
    assertThat(resolver.resolve(null, Language.JAVA)).isEqualTo(new ResolvedType.Unresolved(null));
  }
}
