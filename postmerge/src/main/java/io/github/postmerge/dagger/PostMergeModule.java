package io.github.postmerge.dagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.postmerge.mapping.ColumnAliasesLoader;
import io.github.postmerge.model.ColumnAliases;
import io.github.postmerge.model.MergeConfiguration;
import java.time.Clock;
import javax.inject.Singleton;
import org.apache.poi.ss.usermodel.DataFormatter;

/**
 * The type Post merge module.
 */
@Module
public class PostMergeModule {

  /**
   * Instantiates a new Post merge module.
   */
  public PostMergeModule() {
    // Default constructor
  }

  /**
   * Object mapper for the alias definition.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return objectMapper;
  }

  /**
   * Column aliases: the configured file if any, else the bundled definition.
   *
   * @param objectMapper  the object mapper
   * @param configuration the configuration
   * @return the column aliases
   */
  @Provides
  @Singleton
  public ColumnAliases columnAliases(
      final ObjectMapper objectMapper, final MergeConfiguration configuration) {
    final ColumnAliasesLoader loader = new ColumnAliasesLoader(objectMapper);
    return configuration.aliasFile().map(loader::load).orElseGet(loader::loadDefault);
  }

  /**
   * Cell formatter used when reading workbooks.
   *
   * @return the data formatter
   */
  @Provides
  @Singleton
  public DataFormatter dataFormatter() {
    return new DataFormatter();
  }

  /**
   * Clock for the output file date.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
