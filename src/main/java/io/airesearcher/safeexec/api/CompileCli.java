package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.config.CompositionRoot;
import io.airesearcher.safeexec.config.ExecConfig;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code safeexec compile}: compiles a LaTeX document with shell escape disabled.
 *
 * @since 0.1.0
 */
public final class CompileCli {
  private static final Logger log = LoggerFactory.getLogger(CompileCli.class);
  private static final String SUMMARY_USAGE =
      "usage: compile tex=FILE.tex project=DIR [runs=N] [config=PATH]";
  private static final String HELP_TEXT = """
      SafeExec LaTeX compilation

      Usage:
        compile tex=paper.tex project=papers/p1 [options]

      Required:
        tex=FILE.tex     File name (no directories) inside the project directory
        project=DIR      Existing project directory inside workspaceRoot

      Optional:
        runs=N           Number of passes, 1-10 (default latex.runs)
        config=PATH      YAML configuration (common + compile sections)
        --verbose        Enable DEBUG logging
        --help           Show this message

      Notes:
        Every pass runs with -no-shell-escape. bibtex runs once after the first pass when *.bib exists.
      """;

  private CompileCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliSupport.Prepared prepared = CliSupport.prepare("compile", args, SUMMARY_USAGE, HELP_TEXT, log);
    if (!prepared.ready()) {
      return prepared.exit();
    }
    Map<String, String> options = prepared.options();
    ExecConfig config = prepared.config();

    return CliSupport.execute("compile", log, () -> {
      String tex = ConfigCliUtils.required(options, "tex");
      Path project = CliSupport.workspacePath(config, "project", ConfigCliUtils.required(options, "project"), true);
      int runs = ConfigCliUtils.intOption(options, "runs", config.latexRuns(), 1, 10);
      try (CompositionRoot root = new CompositionRoot(config)) {
        Path output = root.latexCompiler().compile(tex, project, runs);
        CliPrinter.println(output.toString());
        return ExitCode.SUCCESS;
      }
    });
  }
}
