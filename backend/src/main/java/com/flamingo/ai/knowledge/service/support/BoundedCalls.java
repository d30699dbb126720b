package com.flamingo.ai.knowledge.service.support;

import com.flamingo.ai.knowledge.exception.CallTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs backend calls on a dedicated pool under a named Resilience4j {@link TimeLimiter}.
 *
 * <p>The call is cancelled, with interruption, whenever the caller stops waiting for it: on
 * timeout, when the caller thread is interrupted and on any other early exit.
 */
@Component
@Slf4j
public class BoundedCalls {

  public static final String EMBEDDING = "embedding";
  public static final String VECTOR_STORE = "vector-store";
  public static final String CHUNK_STORE = "chunk-store";

  private final AsyncTaskExecutor executor;
  private final TimeLimiterRegistry timeLimiterRegistry;

  public BoundedCalls(
      @Qualifier("backendCallExecutor") AsyncTaskExecutor executor,
      TimeLimiterRegistry timeLimiterRegistry) {
    this.executor = executor;
    this.timeLimiterRegistry = timeLimiterRegistry;
  }

  /**
   * Executes the call and waits for it within the limiter's timeout.
   *
   * @param name time limiter instance name
   * @param call the backend call
   * @return the call result
   * @throws CallTimeoutException if the limit was exceeded
   * @throws CancellationException if the caller was interrupted while waiting
   */
  public <T> T call(String name, Callable<T> call) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Interrupted before calling " + name);
    }
    TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(name);
    Future<T> future = executor.submit(call);
    try {
      return timeLimiter.executeFutureSupplier(() -> future);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for " + name);
    } catch (TimeoutException e) {
      log.warn(
          "Call '{}' exceeded {}", name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
      throw new CallTimeoutException(name, e);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Call '" + name + "' failed: " + e.getMessage(), e);
    } finally {
      if (!future.isDone()) {
        future.cancel(true);
      }
    }
  }

  /** Same as {@link #call(String, Callable)} for calls without a result. */
  public void run(String name, Runnable runnable) {
    call(
        name,
        () -> {
          runnable.run();
          return null;
        });
  }
}
