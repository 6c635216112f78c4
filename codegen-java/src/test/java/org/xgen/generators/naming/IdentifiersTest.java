package org.xgen.generators.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

public class IdentifiersTest {

  @Test
  void shouldSnakeCaseCamelAndAcronyms() {
    assertThat(Identifiers.toSnakeCase("XMLHttpRequest")).isEqualTo("xml_http_request");
    assertThat(Identifiers.toSnakeCase("UserID")).isEqualTo("user_id");
    assertThat(Identifiers.toSnakeCase("already_snake")).isEqualTo("already_snake");
    assertThat(Identifiers.toSnakeCase("kebab-case")).isEqualTo("kebab_case");
    assertThat(Identifiers.toSnakeCase("Max35Text")).isEqualTo("max35_text");
    assertThat(Identifiers.toSnakeCase("ABCDef")).isEqualTo("abc_def");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "XMLHttpRequest", "UserID", "already_snake", "kebab-case", "Max35Text", "ABCDef",
      "GrpHdr", "CdtTrfTxInf", "a-B-c", "HTTP2Server", "x", "", "ÉcoleNormale", "__Leading"
  })
  void snakeCaseIsIdempotent(String input) {
    String once = Identifiers.toSnakeCase(input);
    assertThat(Identifiers.toSnakeCase(once)).isEqualTo(once);
  }

  @Test
  void shouldUppercaseOnlyTheFirstCharacter() {
    assertThat(Identifiers.makeFirstUpperCase("amount")).isEqualTo("Amount");
    assertThat(Identifiers.makeFirstUpperCase("amountDue")).isEqualTo("AmountDue");
    assertThat(Identifiers.toTitle("amount")).isEqualTo("Amount");
  }

  @Test
  void makeFirstUpperCaseIsNoOpWhenAlreadyCapitalized() {
    assertThat(Identifiers.makeFirstUpperCase("Amount")).isEqualTo("Amount");
    assertThat(Identifiers.makeFirstUpperCase("123abc")).isEqualTo("123abc");
    assertThat(Identifiers.makeFirstUpperCase("")).isEmpty();
    assertThat(Identifiers.makeFirstUpperCase(null)).isNull();
  }

  @Test
  void makeFirstUpperCaseHandlesMultiByteCharacters() {
    assertThat(Identifiers.makeFirstUpperCase("éclair")).isEqualTo("Éclair");
    assertThat(Identifiers.makeFirstUpperCase("ßig")).isEqualTo("ßig");
    // U+10428 DESERET SMALL LETTER LONG I, outside the BMP
    assertThat(Identifiers.makeFirstUpperCase("𐐨abc")).isEqualTo("𐐀abc");
  }

  @Test
  void shouldLowercaseFirstCharacter() {
    assertThat(Identifiers.makeFirstLowerCase("Amount")).isEqualTo("amount");
    assertThat(Identifiers.makeFirstLowerCase("amount")).isEqualTo("amount");
  }

  @Test
  void shouldProduceLegalIdentifiers() {
    assertThat(Identifiers.toIdentifier("1st place")).isEqualTo("_1st_place");
    assertThat(Identifiers.toIdentifier("a-b.c")).isEqualTo("a_b_c");
    assertThat(Identifiers.toIdentifier("Straße")).isEqualTo("Straße");
    assertThat(Identifiers.toIdentifier("")).isEqualTo("_");
    assertThat(Identifiers.toIdentifier(null)).isEqualTo("_");
  }

  @Test
  void shouldCamelCaseSeparatedNames() {
    assertThat(Identifiers.toCamelCase("Street-Name")).isEqualTo("streetName");
    assertThat(Identifiers.toCamelCase("user_id")).isEqualTo("userId");
    assertThat(Identifiers.toCamelCase("GrpHdr")).isEqualTo("grpHdr");
    assertThat(Identifiers.toCamelCase("--")).isEqualTo("--");
  }

  @Test
  void shouldConstantCase() {
    assertThat(Identifiers.toConstantCase("inProgress")).isEqualTo("IN_PROGRESS");
    assertThat(Identifiers.toConstantCase("EUR")).isEqualTo("EUR");
    assertThat(Identifiers.toConstantCase("high-value")).isEqualTo("HIGH_VALUE");
  }
}
