package io.airesearcher.safeexec.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes command results (compiled PDF paths, script stdout, dry-run plans) and usage text.
 *
 * <p>Goes straight to file descriptor 1 so that scripts piping SafeExec output never see log lines,
 * which Logback sends to stderr. Tests swap in their own writer.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints text as-is, without appending a line separator.
   *
   * @param text text to emit
   */
  public static void print(String text) {
    PrintWriter writer = writer();
    writer.print(text);
    writer.flush();
  }

  /**
   * Prints zero or more lines to stdout.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
