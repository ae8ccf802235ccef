package io.airesearcher.safeexec.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.airesearcher.safeexec.application.port.MetricsPort;
import io.airesearcher.safeexec.infrastructure.exec.ProcessCommandExecutor;
import io.airesearcher.safeexec.infrastructure.metrics.NoOpMetricsAdapter;
import io.airesearcher.safeexec.support.RecordingCommandExecutor;
import io.airesearcher.safeexec.support.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void wiresProcessExecutorAndNoOpMetricsByDefault() {
    try (CompositionRoot root = new CompositionRoot(ExecConfig.defaults())) {
      assertInstanceOf(ProcessCommandExecutor.class, root.commandExecutor());
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    }
  }

  @Test
  void operationsUseConfiguredBinariesAndSharedExecutor() throws Exception {
    RecordingCommandExecutor executor = new RecordingCommandExecutor();
    ExecConfig config = ExecConfig.fromMap(Map.of("git.binary", "/opt/git/bin/git", "git.depth", "0"));
    Path repo = Files.createDirectories(tempDir.resolve("repo"));

    try (CompositionRoot root = new CompositionRoot(config, executor)) {
      assertSame(executor, root.commandExecutor());
      root.gitOperations().checkout("main", repo, false);
      root.gitOperations().clone("https://example.org/r.git", tempDir.resolve("clone"), null);
    }

    assertEquals(List.of("/opt/git/bin/git", "checkout", "main"), executor.argvs().get(0));
    assertEquals(List.of("/opt/git/bin/git", "clone", "https://example.org/r.git",
        tempDir.resolve("clone").toString()), executor.argvs().get(1));
  }

  @Test
  void createMetricsSelectsAdapterByExporter() {
    RecordingMetricsPort otel = new RecordingMetricsPort();

    assertSame(otel, CompositionRoot.createMetrics("OTLP", () -> otel));
    MetricsPort none = CompositionRoot.createMetrics("none", () -> otel);
    assertTrue(none instanceof NoOpMetricsAdapter);
  }
}
