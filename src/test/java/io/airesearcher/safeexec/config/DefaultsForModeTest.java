package io.airesearcher.safeexec.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void everyModeSharesCommonDefaults() {
    for (String mode : DefaultsForMode.MODES) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("git", defaults.get("git.binary"));
      assertEquals("3", defaults.get("latex.runs"));
      assertEquals("pdflatex", defaults.get("latex.binary"));
      assertEquals("python3", defaults.get("script.interpreter"));
      assertEquals("none", defaults.get("metricsExporter"));
      assertEquals("true", defaults.get("latex.sanitizeSource"));
    }
  }

  @Test
  void modeSpecificKeys() {
    assertEquals("false", DefaultsForMode.asFlatMap("clone").get("dryRun"));
    assertEquals("false", DefaultsForMode.asFlatMap("checkout").get("create"));
    assertFalse(DefaultsForMode.asFlatMap("compile").containsKey("dryRun"));
    assertTrue(DefaultsForMode.asFlatMap(" Script ").containsKey("script.timeoutSeconds"));
  }

  @Test
  void defaultsRoundTripThroughExecConfig() {
    assertEquals(ExecConfig.defaults(), ExecConfig.fromMap(DefaultsForMode.asFlatMap("compile")));
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
