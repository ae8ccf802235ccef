package io.airesearcher.safeexec.application.git;

import io.airesearcher.safeexec.application.port.CommandExecutor;
import io.airesearcher.safeexec.domain.exec.CommandException;
import io.airesearcher.safeexec.domain.exec.CommandSpec;
import io.airesearcher.safeexec.domain.exec.ExecutionResult;
import io.airesearcher.safeexec.validation.GitRefs;
import io.airesearcher.safeexec.validation.Net;
import io.airesearcher.safeexec.validation.ValidatedBranchName;
import io.airesearcher.safeexec.validation.ValidatedUrl;
import io.airesearcher.safeexec.validation.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Repository clone and branch checkout built on validated inputs.
 * <p><strong>Why:</strong> Repository URLs and branch names come from users and model output; both are
 * validated and passed to git as separate argument vector elements.</p>
 * <p><strong>Role:</strong> Application operation over the {@link CommandExecutor} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject malformed URLs, branch names, depths and occupied clone targets before spawning git.</li>
 *   <li>Build the exact {@code git clone} and {@code git checkout} vectors.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 * <p><strong>Observability:</strong> Logs at INFO per operation; failures propagate unchanged and are never
 * retried.</p>
 *
 * @since 0.1.0
 */
public final class GitOperations {
  private static final Logger log = LoggerFactory.getLogger(GitOperations.class);

  /** URL schemes accepted for clone sources. */
  public static final Set<String> CLONE_SCHEMES = Set.of("https", "git");

  private final CommandExecutor executor;
  private final GitSettings settings;

  /**
   * Creates git operations with default settings.
   *
   * @param executor process executor
   */
  public GitOperations(CommandExecutor executor) {
    this(executor, GitSettings.defaults());
  }

  /**
   * Creates git operations.
   *
   * @param executor process executor
   * @param settings binary, timeouts and default depth
   */
  public GitOperations(CommandExecutor executor, GitSettings settings) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Clones with the configured depth and timeout.
   *
   * @see #clone(String, Path, String, int, Duration)
   */
  public ExecutionResult clone(String url, Path targetDir, String branch)
      throws CommandException, InterruptedException, IOException {
    return clone(url, targetDir, branch, settings.defaultDepth(), settings.cloneTimeout());
  }

  /**
   * Clones {@code url} into {@code targetDir}.
   *
   * @param url repository URL; scheme must be one of {@link #CLONE_SCHEMES}
   * @param targetDir directory to create; must not exist
   * @param branch branch to check out, or {@code null} for the remote default
   * @param depth history depth; {@code 0} disables {@code --depth}
   * @param timeout bound for the clone; {@code null} uses the configured default
   * @return git's exit status and output
   * @throws ValidationException if any input is invalid or the target exists; nothing was spawned
   * @throws IOException if parent directories cannot be created
   * @throws CommandException if git fails, times out, or cannot start
   * @throws InterruptedException if interrupted while waiting; git has been killed
   */
  public ExecutionResult clone(String url, Path targetDir, String branch, int depth, Duration timeout)
      throws CommandException, InterruptedException, IOException {
    CommandSpec command = prepareClone(url, targetDir, branch, depth, timeout);
    Path parent = targetDir.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    log.info("Cloning {} into {}", command.argv().get(command.argv().size() - 2), targetDir);
    ExecutionResult result = executor.execute(command);
    log.info("Clone into {} completed in {}ms", targetDir, result.elapsed().toMillis());
    return result;
  }

  /**
   * Validates clone inputs and returns the command that {@link #clone} would run, without touching the
   * filesystem.
   *
   * @return the validated {@code git clone} command
   * @throws ValidationException if any input is invalid or the target exists
   */
  public CommandSpec prepareClone(String url, Path targetDir, String branch, int depth, Duration timeout) {
    ValidatedUrl validatedUrl = Net.validateUrl(url, CLONE_SCHEMES);
    ValidatedBranchName validatedBranch = branch == null ? null : GitRefs.validateBranchName(branch);
    if (depth < 0) {
      throw new ValidationException("depth", "must not be negative", Integer.toString(depth));
    }
    // An absolute target cannot start with '-', so git never reads it as an option.
    Path target = Objects.requireNonNull(targetDir, "targetDir").toAbsolutePath().normalize();
    if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
      throw new ValidationException("target directory", "already exists", targetDir.toString());
    }

    CommandSpec.Builder builder = CommandSpec.builder(settings.binary(), "clone");
    if (validatedBranch != null) {
      builder.arg("--branch").arg(validatedBranch.value());
    }
    if (depth > 0) {
      builder.arg("--depth").arg(Integer.toString(depth));
    }
    return builder
        .arg(validatedUrl.value())
        .arg(target.toString())
        .timeout(timeout == null ? settings.cloneTimeout() : timeout)
        .build();
  }

  /**
   * Checks out with the configured timeout.
   *
   * @see #checkout(String, Path, boolean, Duration)
   */
  public ExecutionResult checkout(String branch, Path repoDir, boolean create)
      throws CommandException, InterruptedException {
    return checkout(branch, repoDir, create, settings.checkoutTimeout());
  }

  /**
   * Checks out {@code branch} inside {@code repoDir}.
   *
   * @param branch branch name
   * @param repoDir existing repository working tree; becomes git's working directory
   * @param create whether to create the branch ({@code -b})
   * @param timeout bound for the checkout; {@code null} uses the configured default
   * @return git's exit status and output
   * @throws ValidationException if the branch is invalid or {@code repoDir} is not a directory
   * @throws CommandException if git fails, times out, or cannot start
   * @throws InterruptedException if interrupted while waiting; git has been killed
   */
  public ExecutionResult checkout(String branch, Path repoDir, boolean create, Duration timeout)
      throws CommandException, InterruptedException {
    CommandSpec command = prepareCheckout(branch, repoDir, create, timeout);
    log.info("Checking out {}branch {} in {}", create ? "new " : "", command.argv().get(command.argv().size() - 1),
        repoDir);
    return executor.execute(command);
  }

  /**
   * Validates checkout inputs and returns the command that {@link #checkout} would run.
   *
   * @return the validated {@code git checkout} command
   * @throws ValidationException if the branch is invalid or {@code repoDir} is not a directory
   */
  public CommandSpec prepareCheckout(String branch, Path repoDir, boolean create, Duration timeout) {
    ValidatedBranchName validatedBranch = GitRefs.validateBranchName(branch);
    if (repoDir == null || !Files.isDirectory(repoDir)) {
      throw new ValidationException("repository directory", "is not a directory", String.valueOf(repoDir));
    }
    CommandSpec.Builder builder = CommandSpec.builder(settings.binary(), "checkout");
    if (create) {
      builder.arg("-b");
    }
    return builder
        .arg(validatedBranch.value())
        .workingDirectory(repoDir)
        .timeout(timeout == null ? settings.checkoutTimeout() : timeout)
        .build();
  }
}
