package io.airesearcher.safeexec.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ScriptCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() throws Exception {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    Files.createDirectories(tempDir.resolve("tools"));
    Files.writeString(tempDir.resolve("tools").resolve("analyze.py"), "print('analysis')\n");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsScriptStdout() {
    ExitCode code = ScriptCli.run(new String[] {
        "script=tools/analyze.py", "workspaceRoot=" + tempDir, "script.interpreter=cat"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("print('analysis')\n", buffer.toString());
  }

  @Test
  void passThroughArgumentsReachTheInterpreterVerbatim() throws Exception {
    Files.writeString(tempDir.resolve("second.txt"), "second\n");

    ExitCode code = ScriptCli.run(new String[] {
        "script=tools/analyze.py", "workspaceRoot=" + tempDir, "script.interpreter=cat", "cwd=.",
        "--", "second.txt"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("print('analysis')\nsecond\n", buffer.toString());
  }

  @Test
  void failingScriptMapsToCommandFailed() {
    ExitCode code = ScriptCli.run(new String[] {
        "script=tools/analyze.py", "workspaceRoot=" + tempDir, "script.interpreter=false"});

    assertEquals(ExitCode.COMMAND_FAILED, code);
  }

  @Test
  void scriptOutsideWorkspaceIsRejected() {
    ExitCode code = ScriptCli.run(new String[] {
        "script=../outside.py", "workspaceRoot=" + tempDir.resolve("tools"), "script.interpreter=cat"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertFalse(buffer.toString().contains("analysis"));
  }
}
