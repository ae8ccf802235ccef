package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.application.git.GitOperations;
import io.airesearcher.safeexec.config.CompositionRoot;
import io.airesearcher.safeexec.config.ExecConfig;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.logging.Logs;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code safeexec checkout}: checks out a branch in an existing repository.
 *
 * @since 0.1.0
 */
public final class CheckoutCli {
  private static final Logger log = LoggerFactory.getLogger(CheckoutCli.class);
  private static final String SUMMARY_USAGE =
      "usage: checkout branch=NAME repo=PATH [--create] [--dry-run] [config=PATH]";
  private static final String HELP_TEXT = """
      SafeExec branch checkout

      Usage:
        checkout branch=feature/x repo=repos/repo [options]

      Required:
        branch=NAME      Branch name ([A-Za-z0-9/_-], no '..', not ending in .lock)
        repo=PATH        Existing repository directory inside workspaceRoot

      Optional:
        --create         Create the branch (git checkout -b)
        --dry-run        Validate inputs and print the git command without running it
        config=PATH      YAML configuration (common + checkout sections)
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private CheckoutCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Prepared prepared = CliSupport.prepare("checkout", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (!prepared.ready()) {
      return prepared.exit();
    }
    Map<String, String> options = prepared.options();
    ExecConfig config = prepared.config();
    boolean create = prepared.input().hasFlag("--create") || ConfigCliUtils.parseBoolean(options, "create", false);
    boolean dryRun = prepared.input().hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(options, "dryRun", false);

    return CliSupport.execute("checkout", log, () -> {
      String branch = ConfigCliUtils.required(options, "branch");
      Path repo = CliSupport.workspacePath(config, "repo", ConfigCliUtils.required(options, "repo"), true);
      try (CompositionRoot root = new CompositionRoot(config)) {
        GitOperations git = root.gitOperations();
        if (dryRun) {
          CommandSpec plan = git.prepareCheckout(branch, repo, create, null);
          CliPrinter.printLines(
              "Checkout dry-run: the working tree will not change.",
              " Command : " + Logs.renderCommand(plan.argv()),
              " Repo    : " + repo);
          return ExitCode.SUCCESS;
        }
        git.checkout(branch, repo, create);
        CliPrinter.println("Checked out " + branch + " in " + repo);
        return ExitCode.SUCCESS;
      }
    });
  }
}
