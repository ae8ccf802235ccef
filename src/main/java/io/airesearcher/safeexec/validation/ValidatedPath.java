package io.airesearcher.safeexec.validation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An absolute, canonical path proven to lie inside a canonical base directory.
 *
 * <p>Created only by {@link Paths#validatePath(String, String, Path, boolean)}. The invariant
 * {@code path().startsWith(base())} holds for every instance.</p>
 *
 * @since 0.1.0
 */
public final class ValidatedPath {
  private final Path path;
  private final Path base;

  ValidatedPath(Path path, Path base) {
    this.path = Objects.requireNonNull(path, "path");
    this.base = Objects.requireNonNull(base, "base");
    if (!path.startsWith(base)) {
      throw new IllegalStateException("validated path " + path + " escapes " + base);
    }
  }

  /** @return canonical absolute path */
  public Path path() {
    return path;
  }

  /** @return canonical base directory the path was checked against */
  public Path base() {
    return base;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValidatedPath that && path.equals(that.path) && base.equals(that.base);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, base);
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
