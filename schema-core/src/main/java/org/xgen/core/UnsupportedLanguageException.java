package org.xgen.core;

/**
 * Raised when a target language identifier is not one of {@link Language}.
 * This is a configuration error and aborts the whole generation run.
 */
public class UnsupportedLanguageException extends IllegalArgumentException {

  private final String languageId;

  public UnsupportedLanguageException(String languageId) {
    super("Unsupported target language: " + languageId + " (expected one of " + Language.ids() + ")");
    this.languageId = languageId;
  }

  public String getLanguageId() {
    return languageId;
  }
}
