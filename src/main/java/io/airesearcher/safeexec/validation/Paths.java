package io.airesearcher.safeexec.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Filesystem path validation against a base-directory sandbox.
 * <p><strong>Why:</strong> Paper directories, clone targets and script locations are derived from user
 * and model input; each must stay inside the workspace the caller designated.</p>
 * <p><strong>Role:</strong> Support utility executed before git, LaTeX or script operations touch the
 * filesystem.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve relative input against the base directory.</li>
 *   <li>Canonicalize both sides, following symlinks of every existing ancestor.</li>
 *   <li>Reject results that escape the base, and optionally results that do not exist.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; results reflect the filesystem at call time.</p>
 * <p><strong>Observability:</strong> Emits no logs; exception messages include the offending path.</p>
 *
 * @implNote Missing trailing segments are normalized lexically and appended to the real path of the
 * nearest existing ancestor, so a symlink inside the base that points outside it is still caught.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates {@code userPath} against {@code baseDir} using the diagnostic label {@code "path"}.
   *
   * @param userPath relative or absolute path supplied by the caller
   * @param baseDir security boundary
   * @param mustExist whether the target must already exist
   * @return canonical path inside the canonical base
   * @throws ValidationException if the path is malformed, escapes the base, or is missing when required
   */
  public static ValidatedPath validatePath(String userPath, Path baseDir, boolean mustExist) {
    return validatePath("path", userPath, baseDir, mustExist);
  }

  /**
   * Validates {@code userPath} against {@code baseDir}.
   *
   * @param name logical field name for diagnostics
   * @param userPath relative or absolute path supplied by the caller
   * @param baseDir security boundary; must not be {@code null}
   * @param mustExist whether the target must already exist
   * @return canonical path inside the canonical base
   * @throws ValidationException if the path is malformed, escapes the base, or is missing when required
   */
  public static ValidatedPath validatePath(String name, String userPath, Path baseDir, boolean mustExist) {
    Objects.requireNonNull(baseDir, "baseDir");
    String raw = Strings.requireNonBlank(name, userPath);
    final Path candidate;
    try {
      candidate = Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new ValidationException(name, "is not a valid path", raw, ex);
    }

    Path base = canonicalize(name, baseDir.toAbsolutePath().normalize());
    Path target = candidate.isAbsolute() ? candidate : base.resolve(candidate);
    Path canonical = canonicalize(name, target.toAbsolutePath().normalize());

    if (!canonical.startsWith(base)) {
      throw new ValidationException(
          name, "is outside base directory " + base + " (resolved to " + canonical + ")", raw);
    }
    if (mustExist && !Files.exists(canonical)) {
      throw new ValidationException(name, "does not exist: " + canonical, raw);
    }
    return new ValidatedPath(canonical, base);
  }

  private static Path canonicalize(String name, Path normalized) {
    try {
      Path existing = nearestExistingAncestor(normalized);
      if (existing == null) {
        return normalized;
      }
      Path real = existing.toRealPath();
      Path remainder = existing.relativize(normalized);
      return remainder.toString().isEmpty() ? real : real.resolve(remainder).normalize();
    } catch (IOException ex) {
      throw new ValidationException(name, "cannot be canonicalized: " + ex.getMessage(), normalized.toString(), ex);
    }
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    return current;
  }
}
