package io.airesearcher.safeexec.domain.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.airesearcher.safeexec.domain.latex.PdfNotProducedException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandExceptionTest {

  @Test
  void workingDirectorySurvivesSerialization() throws Exception {
    CommandSpec command = CommandSpec.builder("git", "checkout", "main")
        .workingDirectory(Path.of("/work/repo"))
        .timeout(Duration.ofSeconds(3))
        .build();

    CommandTimeoutException copy = reserialize(new CommandTimeoutException(command));

    assertEquals(List.of("git", "checkout", "main"), copy.argv());
    assertEquals(Optional.of(Path.of("/work/repo")), copy.workingDirectory());
    assertEquals(Duration.ofSeconds(3), copy.timeout());
  }

  @Test
  void inheritedWorkingDirectoryStaysEmpty() throws Exception {
    CommandException copy = reserialize(
        new CommandException("boom", CommandSpec.of(List.of("true")), null));

    assertEquals(Optional.empty(), copy.workingDirectory());
    assertEquals("boom", copy.getMessage());
  }

  @Test
  void missingPdfKeepsExpectedPathAcrossSerialization() throws Exception {
    PdfNotProducedException copy = reserialize(new PdfNotProducedException(
        Path.of("/papers/p1/paper.pdf"), List.of("pdflatex", "paper.tex"), Path.of("/papers/p1")));

    assertEquals(Path.of("/papers/p1/paper.pdf"), copy.expected());
    assertEquals(Optional.of(Path.of("/papers/p1")), copy.workingDirectory());
  }

  @SuppressWarnings("unchecked")
  private static <T extends Exception> T reserialize(T exception) throws IOException, ClassNotFoundException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(exception);
    }
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      return (T) in.readObject();
    }
  }
}
