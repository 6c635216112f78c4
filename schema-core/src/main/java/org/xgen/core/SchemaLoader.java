package org.xgen.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xgen.core.model.SchemaDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a parsed node document (JSON) into a {@link SchemaDocument}.
 *
 * <p>Children nested in complex types and groups may omit {@code "kind"};
 * their declared type is used.
 */
public final class SchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

  private static final ObjectMapper JSON = JsonMapper.builder()
      .enable(MapperFeature.USE_BASE_TYPE_AS_DEFAULT_IMPL)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private SchemaLoader() {}

  public static SchemaDocument load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    SchemaDocument document = read(bytes);
    log.debug("Loaded {} schema nodes from {}", document.nodes().size(), path);
    return document;
  }

  public static SchemaDocument read(byte[] bytes) throws IOException {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("schema document is empty");
    }
    SchemaDocument document = JSON.readValue(bytes, SchemaDocument.class);
    if (document == null) {
      throw new IllegalArgumentException("schema document is empty");
    }
    return document;
  }
}
