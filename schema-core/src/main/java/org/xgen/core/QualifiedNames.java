package org.xgen.core;

/**
 * Namespace prefix handling for qualified names such as {@code "xs:string"}.
 *
 * <p>Only names with exactly one colon are treated as prefixed. Names with no
 * colon, or with more than one, pass through as unprefixed.
 */
public final class QualifiedNames {

  private QualifiedNames() {}

  /** {@code "ns:Foo"} → {@code "ns"}; anything else → {@code ""}. */
  public static String getNsPrefix(String name) {
    String[] parts = split(name);
    return parts.length == 2 ? parts[0] : "";
  }

  /** {@code "ns:Foo"} → {@code "Foo"}; anything else is returned unchanged. */
  public static String trimNsPrefix(String name) {
    String[] parts = split(name);
    return parts.length == 2 ? parts[1] : name;
  }

  // limit -1 keeps empty segments: "a:" still counts as one colon
  private static String[] split(String name) {
    if (name == null) return new String[0];
    return name.split(":", -1);
  }
}
