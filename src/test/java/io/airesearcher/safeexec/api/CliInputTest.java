package io.airesearcher.safeexec.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"url=https://x.org/r", "--DRY-RUN", "-v", " ", "depth=2"});

    assertArrayEquals(new String[] {"url=https://x.org/r", "depth=2"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognizesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void argumentsAfterDoubleDashPassThroughVerbatim() {
    CliInput input = CliInput.parse(new String[] {
        "script=a.py", "--", "--help", "x=1", " spaced ", "; rm -rf /"});

    assertEquals(List.of("--help", "x=1", " spaced ", "; rm -rf /"), input.passThrough());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"script=a.py"}, input.keyValueArgs());
  }
}
