package io.airesearcher.safeexec.domain.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CompilationStateTest {

  @Test
  void walksPassesWithBibliographyAfterFirstPass() {
    CompilationState state = CompilationState.start(3);
    assertEquals(CompilationPhase.INIT, state.phase());
    assertFalse(state.needsBibliographyCheck());

    state = state.passCompleted();
    assertTrue(state.needsBibliographyCheck());
    state = state.bibliographyCompleted();
    assertEquals(CompilationPhase.BIBLIOGRAPHY, state.phase());
    assertFalse(state.needsBibliographyCheck());

    state = state.passCompleted();
    assertFalse(state.needsBibliographyCheck());
    state = state.passCompleted();
    assertFalse(state.hasMorePasses());

    state = state.done(Path.of("paper.pdf"));
    assertEquals(CompilationPhase.DONE, state.phase());
    assertEquals(Optional.of(Path.of("paper.pdf")), state.artifact());
    assertTrue(state.bibliographyRan());
  }

  @Test
  void rejectsOutOfOrderTransitions() {
    CompilationState start = CompilationState.start(2);
    assertThrows(IllegalStateException.class, start::bibliographyCompleted);
    assertThrows(IllegalStateException.class, () -> start.done(Path.of("x.pdf")));

    CompilationState afterTwo = start.passCompleted().passCompleted();
    assertThrows(IllegalStateException.class, afterTwo::bibliographyCompleted);
    assertThrows(IllegalStateException.class, afterTwo::passCompleted);

    CompilationState failed = start.passCompleted().failed();
    assertFalse(failed.hasMorePasses());
    assertThrows(IllegalStateException.class, failed::passCompleted);
  }

  @Test
  void requiresAtLeastOnePass() {
    assertThrows(IllegalArgumentException.class, () -> CompilationState.start(0));
  }
}
