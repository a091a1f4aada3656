package io.github.postmerge.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.postmerge.model.ColumnAliases;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link ColumnAliases} definitions from JSON.
 */
public class ColumnAliasesLoader {

  /**
   * Classpath resource with the bundled definition.
   */
  public static final String DEFAULT_RESOURCE = "column-aliases.json";

  private static final Logger log = LoggerFactory.getLogger(ColumnAliasesLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Constructor.
   *
   * @param objectMapper the object mapper
   */
  public ColumnAliasesLoader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * The bundled definition.
   *
   * @return the aliases
   */
  public ColumnAliases loadDefault() {
    try (final InputStream in =
        ColumnAliasesLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
      }
      return objectMapper.readValue(in, ColumnAliases.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * A definition file.
   *
   * @param file the JSON file
   * @return the aliases
   */
  public ColumnAliases load(final Path file) {
    log.info("Loading column aliases from {}", file);
    try {
      return objectMapper.readValue(file.toFile(), ColumnAliases.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read column aliases from " + file, e);
    }
  }
}
