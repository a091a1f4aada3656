package io.github.postmerge.cli;

import io.github.postmerge.cli.command.MergeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * {@code postmerge} command. Its {@code merge} subcommand combines the shipment files found in
 * {@code <base-dir>/Input} into the dated post workbook under {@code <base-dir>/Output}; the exit
 * status reports whether anything was merged.
 */
@Command(
    name = "postmerge",
    description = "Merges per-sender shipment files into one post file",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {MergeCommand.class})
public class PostMergeCli implements Runnable {

  /**
   * Runs the command and exits with its status.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new PostMergeCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // no subcommand given
    CommandLine.usage(this, System.out);
  }
}
