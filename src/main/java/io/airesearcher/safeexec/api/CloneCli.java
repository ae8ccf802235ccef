package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.application.git.GitOperations;
import io.airesearcher.safeexec.config.CompositionRoot;
import io.airesearcher.safeexec.config.ExecConfig;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.logging.Logs;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code safeexec clone}: clones a repository into the workspace.
 *
 * @since 0.1.0
 */
public final class CloneCli {
  private static final Logger log = LoggerFactory.getLogger(CloneCli.class);
  private static final String SUMMARY_USAGE =
      "usage: clone url=URL target=PATH [branch=NAME] [depth=N] [--dry-run] [config=PATH]";
  private static final String HELP_TEXT = """
      SafeExec repository clone

      Usage:
        clone url=https://github.com/org/repo target=repos/repo [options]

      Required:
        url=URL          https:// or git:// repository URL (no local hosts)
        target=PATH      Directory to create, inside workspaceRoot; must not exist

      Optional:
        branch=NAME      Branch to check out after cloning
        depth=N          History depth; 0 clones full history (default git.depth)
        workspaceRoot=DIR  Directory that target must stay inside
        config=PATH      YAML configuration (common + clone sections)
        --dry-run        Validate inputs and print the git command without running it
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private CloneCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Prepared prepared = CliSupport.prepare("clone", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (!prepared.ready()) {
      return prepared.exit();
    }
    Map<String, String> options = prepared.options();
    ExecConfig config = prepared.config();
    boolean dryRun = prepared.input().hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(options, "dryRun", false);

    return CliSupport.execute("clone", log, () -> {
      String url = ConfigCliUtils.required(options, "url");
      Path target = CliSupport.workspacePath(config, "target", ConfigCliUtils.required(options, "target"), false);
      String branch = ConfigCliUtils.optional(options, "branch");
      int depth = ConfigCliUtils.intOption(options, "depth", config.gitDepth(), 0, 1_000_000);

      try (CompositionRoot root = new CompositionRoot(config)) {
        GitOperations git = root.gitOperations();
        if (dryRun) {
          CommandSpec plan = git.prepareClone(url, target, branch, depth, null);
          CliPrinter.printLines(
              "Clone dry-run: nothing will be cloned.",
              " Command : " + Logs.renderCommand(plan.argv()),
              " Target  : " + target,
              " Timeout : " + plan.timeout().toSeconds() + "s",
              " Re-run without --dry-run to clone.");
          return ExitCode.SUCCESS;
        }
        ExecutionResult result = git.clone(url, target, branch, depth, null);
        CliPrinter.println("Cloned into " + target + " (" + result.elapsed().toMillis() + "ms)");
        return ExitCode.SUCCESS;
      }
    });
  }
}
