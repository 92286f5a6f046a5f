package com.flamingo.ai.constitution.task;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Fire-and-forget queue for work that must not delay the caller.
 *
 * <p>Inside a web request a task is held until the request completes and is then handed to the
 * {@code deferredTaskExecutor}; outside a request it is handed over immediately. Failures and
 * rejections are logged and counted, never retried.
 */
@Component
@Slf4j
public class DeferredTaskQueue {

  private final Executor executor;
  private final MeterRegistry meterRegistry;
  private final AtomicLong sequence = new AtomicLong();

  public DeferredTaskQueue(
      @Qualifier("deferredTaskExecutor") Executor executor, MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Submits a task to run after the current request, or as soon as possible when there is none.
   *
   * @param description short label used in logs and metrics
   * @param task the work
   */
  public void submit(String description, Runnable task) {
    RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
    if (attributes != null) {
      try {
        attributes.registerDestructionCallback(
            "deferred-task-" + sequence.incrementAndGet(),
            () -> dispatch(description, task),
            RequestAttributes.SCOPE_REQUEST);
        return;
      } catch (IllegalStateException e) {
        log.debug("Request already completed, dispatching '{}' directly", description);
      }
    }
    dispatch(description, task);
  }

  private void dispatch(String description, Runnable task) {
    try {
      executor.execute(() -> runSafely(description, task));
    } catch (RejectedExecutionException e) {
      log.warn("Deferred task '{}' rejected: {}", description, e.getMessage());
      meterRegistry.counter("constitution.deferred.rejected").increment();
    }
  }

  private void runSafely(String description, Runnable task) {
    try {
      task.run();
      log.debug("Deferred task '{}' completed", description);
    } catch (RuntimeException e) {
      log.warn("Deferred task '{}' failed: {}", description, e.getMessage(), e);
      meterRegistry.counter("constitution.deferred.failed").increment();
    }
  }
}
