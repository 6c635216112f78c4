package org.xgen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Facets of an {@code xs:restriction}. Only pattern, enumeration and length
 * facets are modelled.
 *
 * @param pattern     regular expression from {@code xs:pattern}, or {@code null}
 * @param enumeration allowed literals in declaration order, never {@code null}
 * @param minLength   {@code xs:minLength} value, {@code null} when absent
 * @param maxLength   {@code xs:maxLength} value, {@code null} when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Restriction(
    String pattern,
    @JsonAlias({"enum", "enumValues"}) List<String> enumeration,
    Integer minLength,
    Integer maxLength
) {
  public static final Restriction NONE = new Restriction(null, List.of(), null, null);

  public Restriction {
    enumeration = enumeration == null ? List.of() : List.copyOf(enumeration);
  }

  public static Restriction ofEnumeration(List<String> values) {
    return new Restriction(null, values, null, null);
  }

  public static Restriction ofPattern(String pattern) {
    return new Restriction(pattern, List.of(), null, null);
  }

  public boolean hasMinLength() {
    return minLength != null;
  }

  public boolean hasMaxLength() {
    return maxLength != null;
  }

  /** True when any facet narrows the base type. */
  public boolean hasConstraints() {
    return pattern != null || !enumeration.isEmpty() || hasMinLength() || hasMaxLength();
  }
}
