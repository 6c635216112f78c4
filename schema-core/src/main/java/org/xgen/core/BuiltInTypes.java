package org.xgen.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Spellings of the XSD built-in datatypes in each {@link Language}.
 *
 * <p>Keys are the exact, case-sensitive names from
 * <a href="https://www.w3.org/TR/xmlschema-2/#datatype">XML Schema Part 2</a>,
 * plus the {@code xml:} pseudo-types which are strings in every language.
 * Each row lists spellings in {@link Language} ordinal order:
 *
 * <pre>
 *   Go, TypeScript, C, Java, Rust
 * </pre>
 *
 * A miss is not an error: it means the name is user-defined and should be
 * handed to {@link TypeResolver}.
 */
public final class BuiltInTypes {

  private static final Map<String, List<String>> TABLE = Map.ofEntries(
      entry("anyType",            row("string", "string", "char", "String", "String")),
      entry("ENTITIES",           row("[]string", "Array<string>", "char[]", "List<String>", "Vec<String>")),
      entry("ENTITY",             row("string", "string", "char", "String", "String")),
      entry("ID",                 row("string", "string", "char", "String", "String")),
      entry("IDREF",              row("string", "string", "char", "String", "String")),
      entry("IDREFS",             row("[]string", "Array<string>", "char[]", "List<String>", "Vec<String>")),
      entry("NCName",             row("string", "string", "char", "String", "String")),
      entry("NMTOKEN",            row("string", "string", "char", "String", "String")),
      entry("NMTOKENS",           row("[]string", "Array<string>", "char[]", "List<String>", "Vec<String>")),
      entry("NOTATION",           row("[]string", "Array<string>", "char[]", "List<String>", "Vec<String>")),
      entry("Name",               row("string", "string", "char", "String", "String")),
      entry("QName",              row("xml.Name", "any", "char", "String", "String")),
      entry("anyURI",             row("string", "string", "char", "QName", "String")),
      entry("base64Binary",       row("string", "Uint8Array", "char[]", "List<Byte>", "String")),
      entry("boolean",            row("bool", "boolean", "bool", "Boolean", "bool")),
      entry("byte",               row("int8", "any", "char[]", "Byte", "u8")),
      entry("date",               row("string", "string", "char", "String", "String")),
      entry("dateTime",           row("string", "string", "char", "String", "String")),
      entry("decimal",            row("float64", "number", "float", "Float", "f64")),
      entry("double",             row("float64", "number", "float", "Float", "f64")),
      entry("duration",           row("string", "string", "char", "String", "String")),
      entry("float",              row("float32", "number", "float", "Float", "f64")),
      entry("gDay",               row("string", "string", "char", "String", "String")),
      entry("gMonth",             row("string", "string", "char", "String", "String")),
      entry("gMonthDay",          row("string", "string", "char", "String", "String")),
      entry("gYear",              row("string", "string", "char", "String", "String")),
      entry("gYearMonth",         row("string", "string", "char", "String", "String")),
      entry("hexBinary",          row("string", "Uint8Array", "char[]", "List<Byte>", "String")),
      entry("int",                row("int", "number", "int", "Integer", "i32")),
      entry("integer",            row("int", "number", "int", "Integer", "i32")),
      entry("language",           row("string", "string", "char", "String", "String")),
      entry("long",               row("int64", "number", "int", "Long", "i64")),
      entry("negativeInteger",    row("int", "number", "int", "Integer", "i32")),
      entry("nonNegativeInteger", row("int", "number", "int", "Integer", "u32")),
      entry("normalizedString",   row("string", "string", "char", "String", "String")),
      entry("nonPositiveInteger", row("int", "number", "int", "Integer", "i32")),
      entry("positiveInteger",    row("int", "number", "int", "Integer", "u32")),
      entry("short",              row("int16", "number", "int", "Integer", "i16")),
      entry("string",             row("string", "string", "char", "String", "String")),
      entry("time",               row("time.Time", "string", "char", "String", "String")),
      entry("token",              row("string", "string", "char", "String", "String")),
      entry("unsignedByte",       row("uint8", "any", "char", "Byte", "u8")),
      entry("unsignedInt",        row("uint32", "number", "unsigned int", "Integer", "u32")),
      entry("unsignedLong",       row("uint64", "number", "unsigned int", "Long", "u64")),
      entry("unsignedShort",      row("uint16", "number", "unsigned int", "Short", "u16")),
      entry("xml:lang",           row("string", "string", "char", "String", "String")),
      entry("xml:space",          row("string", "string", "char", "String", "String")),
      entry("xml:base",           row("string", "string", "char", "String", "String")),
      entry("xml:id",             row("string", "string", "char", "String", "String"))
  );

  private BuiltInTypes() {}

  /**
   * Spelling of a built-in type in the given language.
   *
   * @param name     exact XSD name, e.g. {@code "unsignedInt"} or {@code "xml:lang"}
   * @param language target language
   * @return the spelling, or empty when {@code name} is not built-in
   */
  public static Optional<String> lookup(String name, Language language) {
    if (language == null) {
      throw new IllegalArgumentException("language is required");
    }
    if (name == null) {
      return Optional.empty();
    }
    List<String> spellings = TABLE.get(name);
    if (spellings == null) {
      return Optional.empty();
    }
    return Optional.of(spellings.get(language.ordinal()));
  }

  /**
   * Same as {@link #lookup(String, Language)} with the language given by identifier.
   *
   * @throws UnsupportedLanguageException if {@code languageId} is not supported
   */
  public static Optional<String> lookup(String name, String languageId) {
    return lookup(name, Language.fromId(languageId));
  }

  public static boolean isBuiltIn(String name) {
    return name != null && TABLE.containsKey(name);
  }

  public static Set<String> names() {
    return TABLE.keySet();
  }

  private static List<String> row(String go, String typeScript, String c, String java, String rust) {
    return List.of(go, typeScript, c, java, rust);
  }
}
