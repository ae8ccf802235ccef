package io.airesearcher.safeexec.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IdentifiersTest {

  @Test
  void acceptsAlphanumericWithDefaultSeparators() {
    assertEquals("vq_vae-2", Identifiers.validateIdentifier("paper id", "vq_vae-2").value());
  }

  @Test
  void stripsSurroundingWhitespace() {
    assertEquals("paper1", Identifiers.validateIdentifier("paper id", "  paper1 \n").value());
  }

  @Test
  void everyShellMetacharacterIsRejectedWhateverTheCharsetFlags() {
    for (char c : DeniedTokens.SHELL_METACHARACTERS.toCharArray()) {
      String candidate = "a" + c + "b";
      ValidationException permissive = assertThrows(ValidationException.class,
          () -> Identifiers.validateIdentifier("id", candidate, 50, true, true, true));
      assertTrue(permissive.reason().contains("shell metacharacters"), permissive.getMessage());
      assertThrows(ValidationException.class,
          () -> Identifiers.validateIdentifier("id", candidate, 50, false, false, false));
    }
  }

  @Test
  void namesTheOffendingMetacharacters() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> Identifiers.validateIdentifier("paper id", "x;y|z"));
    assertTrue(ex.getMessage().contains("';'"));
    assertTrue(ex.getMessage().contains("'|'"));
    assertEquals("paper id", ex.field());
  }

  @Test
  void rejectsTraversalAndDisallowedSeparators() {
    assertThrows(ValidationException.class,
        () -> Identifiers.validateIdentifier("id", "a..b", 50, true, true, true));
    assertThrows(ValidationException.class, () -> Identifiers.validateIdentifier("id", "a/b"));
    assertEquals("a/b", Identifiers.validateIdentifier("id", "a/b", 50, true, true, true).value());
    assertThrows(ValidationException.class,
        () -> Identifiers.validateIdentifier("id", "a-b", 50, false, true, false));
  }

  @Test
  void rejectsBlankNulAndOverlongValues() {
    assertThrows(ValidationException.class, () -> Identifiers.validateIdentifier("id", null));
    assertThrows(ValidationException.class, () -> Identifiers.validateIdentifier("id", "   "));
    assertThrows(ValidationException.class, () -> Identifiers.validateIdentifier("id", "a\0b"));
    ValidationException tooLong = assertThrows(ValidationException.class,
        () -> Identifiers.validateIdentifier("id", "a".repeat(51)));
    assertTrue(tooLong.reason().contains("too long"));
  }

  @Test
  void modelNamesAllowDotsAndSlashes() {
    assertEquals("openrouter/google/gemini-2.5-pro",
        Identifiers.validateModelName("openrouter/google/gemini-2.5-pro").value());
    assertThrows(ValidationException.class, () -> Identifiers.validateModelName("gpt 4"));
    assertThrows(ValidationException.class, () -> Identifiers.validateModelName("../secrets"));
    assertThrows(ValidationException.class, () -> Identifiers.validateModelName("m".repeat(201)));
  }

  @Test
  void offendingValueIsTruncatedInDiagnostics() {
    String huge = "x".repeat(500) + ";";
    ValidationException ex = assertThrows(ValidationException.class,
        () -> Identifiers.validateIdentifier("id", huge, 1_000, true, true, false));
    assertTrue(ex.offendingValue().contains("truncated"));
    assertTrue(ex.getMessage().length() < 300);
  }
}
