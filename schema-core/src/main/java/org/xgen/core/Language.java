package org.xgen.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Supported target languages. The set is closed: the ordinal is the column
 * index into {@link BuiltInTypes}, so adding a language means adding a
 * spelling to every table row.
 */
public enum Language {
  GO("Go"),
  TYPESCRIPT("TypeScript"),
  C("C"),
  JAVA("Java"),
  RUST("Rust");

  private final String id;

  Language(String id) {
    this.id = id;
  }

  /** Identifier as used in configuration and hook names, e.g. {@code "TypeScript"}. */
  @JsonValue
  public String id() {
    return id;
  }

  /**
   * Look up a language by its exact identifier.
   *
   * @throws UnsupportedLanguageException if {@code id} is not supported
   */
  @JsonCreator
  public static Language fromId(String id) {
    for (Language language : values()) {
      if (language.id.equals(id)) {
        return language;
      }
    }
    throw new UnsupportedLanguageException(id);
  }

  public static List<String> ids() {
    return Arrays.stream(values()).map(Language::id).toList();
  }
}
