package io.github.postmerge.dagger;

import dagger.Component;
import io.github.postmerge.model.MergeConfiguration;
import io.github.postmerge.pipeline.MergePipeline;
import io.github.postmerge.pipeline.MergeRunner;
import javax.inject.Singleton;

/**
 * The interface Post merge component.
 */
@Singleton
@Component(modules = {PostMergeModule.class, ConfigurationModule.class})
public interface PostMergeComponent {

  /**
   * Instance post merge component.
   *
   * @param configuration the configuration
   * @return the post merge component
   */
  static PostMergeComponent instance(final MergeConfiguration configuration) {
    return DaggerPostMergeComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Merge pipeline.
   *
   * @return the merge pipeline
   */
  MergePipeline mergePipeline();

  /**
   * Merge runner.
   *
   * @return the merge runner
   */
  MergeRunner mergeRunner();
}
