package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.config.CompositionRoot;
import io.airesearcher.safeexec.config.ExecConfig;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.logging.Logs;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code safeexec script}: runs an interpreter script and prints its standard output.
 *
 * @since 0.1.0
 */
public final class ScriptCli {
  private static final Logger log = LoggerFactory.getLogger(ScriptCli.class);
  private static final String SUMMARY_USAGE =
      "usage: script script=PATH [cwd=DIR] [config=PATH] -- [args...]";
  private static final String HELP_TEXT = """
      SafeExec script runner

      Usage:
        script script=tools/analyze.py [cwd=papers/p1] -- --input data.csv

      Required:
        script=PATH      Script inside workspaceRoot with the configured extension (default .py)

      Optional:
        cwd=DIR          Working directory inside workspaceRoot
        -- args...       Arguments passed to the script verbatim
        config=PATH      YAML configuration (common + script sections)
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;
  private static final int LOGGED_STDERR_BYTES = 2_048;

  private ScriptCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Prepared prepared = CliSupport.prepare("script", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (!prepared.ready()) {
      return prepared.exit();
    }
    Map<String, String> options = prepared.options();
    ExecConfig config = prepared.config();
    List<String> scriptArgs = prepared.input().passThrough();

    return CliSupport.execute("script", log, () -> {
      Path script = CliSupport.workspacePath(config, "script", ConfigCliUtils.required(options, "script"), true);
      String cwdRaw = ConfigCliUtils.optional(options, "cwd");
      Path cwd = cwdRaw == null ? null : CliSupport.workspacePath(config, "cwd", cwdRaw, true);
      try (CompositionRoot root = new CompositionRoot(config)) {
        ExecutionResult result = root.scriptRunner().run(script, scriptArgs, cwd, null, Map.of());
        if (!result.stderr().isBlank()) {
          log.info("Script stderr: {}", Logs.truncate(result.stderr(), LOGGED_STDERR_BYTES));
        }
        CliPrinter.print(result.stdout());
        return ExitCode.SUCCESS;
      }
    });
  }
}
