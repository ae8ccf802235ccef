package io.airesearcher.safeexec.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CheckoutCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() throws Exception {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    Files.createDirectories(tempDir.resolve("repo"));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunShowsCreateCommand() {
    ExitCode code = CheckoutCli.run(new String[] {
        "branch=exp/lr-sweep", "repo=repo", "workspaceRoot=" + tempDir, "--create", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" Command : git checkout -b exp/lr-sweep"), buffer.toString());
  }

  @Test
  void missingRepositoryIsInvalidInput() {
    ExitCode code = CheckoutCli.run(new String[] {
        "branch=main", "repo=absent", "workspaceRoot=" + tempDir, "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void traversingBranchIsInvalidInput() {
    ExitCode code = CheckoutCli.run(new String[] {
        "branch=../../etc", "repo=repo", "workspaceRoot=" + tempDir, "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
