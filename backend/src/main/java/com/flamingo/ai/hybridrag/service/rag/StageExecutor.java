package com.flamingo.ai.hybridrag.service.rag;

import com.flamingo.ai.hybridrag.exception.StageFailureException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs external pipeline stages on the retrieval executor with a per-call timeout.
 *
 * <p>Failures and timeouts surface as {@link StageFailureException}. Interruption of the waiting
 * thread cancels the in-flight task and propagates as {@link InterruptedException}.
 */
@Component
@Slf4j
public class StageExecutor {

  private final AsyncTaskExecutor executor;

  public StageExecutor(@Qualifier("retrievalExecutor") AsyncTaskExecutor executor) {
    this.executor = executor;
  }

  /**
   * Starts a stage without waiting for it.
   *
   * @param stage stage name for logs and errors
   * @param task the external call
   * @return the running task
   */
  public <T> Future<T> submit(String stage, Callable<T> task) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new StageFailureException(stage, "executor rejected the task", e);
    }
  }

  /**
   * Waits for a running stage.
   *
   * @param stage stage name for logs and errors
   * @param future the running task
   * @param timeout how long to wait before cancelling it
   * @return the stage result
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public <T> T await(String stage, Future<T> future, Duration timeout)
      throws InterruptedException {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Stage '{}' timed out after {} ms", stage, timeout.toMillis());
      throw new StageFailureException(stage, "timed out after " + timeout, e, true);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new StageFailureException(stage, String.valueOf(cause.getMessage()), cause);
    } catch (CancellationException e) {
      throw new StageFailureException(stage, "cancelled", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  /**
   * Runs a stage and waits for it.
   *
   * @see #await(String, Future, Duration)
   */
  public <T> T call(String stage, Duration timeout, Callable<T> task) throws InterruptedException {
    return await(stage, submit(stage, task), timeout);
  }

  /** Cancels stages still running, e.g. after the caller gave up. */
  public void cancelAll(Future<?>... futures) {
    for (Future<?> future : futures) {
      if (future != null && !future.isDone()) {
        future.cancel(true);
      }
    }
  }
}
