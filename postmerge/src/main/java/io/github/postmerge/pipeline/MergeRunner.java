package io.github.postmerge.pipeline;

import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.MergeSummary;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs merges on a single background worker, one at a time, so the caller's thread stays free.
 */
@Singleton
public class MergeRunner implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MergeRunner.class);

  private final MergePipeline mergePipeline;
  private final ExecutorService executor;

  /**
   * Constructor.
   */
  @Inject
  public MergeRunner(final MergePipeline mergePipeline) {
    this.mergePipeline = mergePipeline;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      final Thread thread = new Thread(runnable, "postmerge-worker");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Start a merge on the worker.
   *
   * @param baseDirectory the base directory
   * @param sink          the log sink, called from the worker thread
   * @return the pending summary
   */
  public Future<MergeSummary> submit(final Path baseDirectory, final LogSink sink) {
    log.info("Submitting merge of {}", baseDirectory);
    return executor.submit(() -> {
      final MergeSummary summary = mergePipeline.run(baseDirectory, sink);
      sink.emit("Processing complete!");
      return summary;
    });
  }

  /**
   * Run a merge on the worker and wait for it.
   *
   * @param baseDirectory the base directory
   * @param sink          the log sink
   * @return the summary
   * @throws InterruptedException if interrupted while waiting
   */
  public MergeSummary runAndWait(final Path baseDirectory, final LogSink sink)
      throws InterruptedException {
    try {
      return submit(baseDirectory, sink).get();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Merge worker failed", e.getCause());
    }
  }

  @Override
  public void close() {
    executor.shutdown();
  }
}
