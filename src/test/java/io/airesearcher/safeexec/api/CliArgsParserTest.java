package io.airesearcher.safeexec.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"tex=paper.tex", "latex.runs=2"});
    assertEquals("paper.tex", map.get("tex"));
    assertEquals("2", map.get("latex.runs"));
  }

  @Test
  void keepsEqualsSignsInValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod,team=ml"});
    assertEquals("env=prod,team=ml", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a=1", "a=2"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k$y=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\u0007b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\0b"}));
  }
}
