package io.airesearcher.safeexec.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executor services used around child processes.
 */
public final class ExecutorFactories {
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded, idle-shrinking pool of daemon threads for draining process output.
   *
   * <p>Each running process occupies two threads (stdout and stderr) until its pipes reach end of
   * stream. Daemon threads never keep the JVM alive.</p>
   *
   * @param prefix thread-name prefix used to tag drainer threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newStreamDrainerPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "safeexec-drain" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
