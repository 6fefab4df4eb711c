package io.trektribe.backend.notification.fanout;

import io.trektribe.backend.exception.ValidationFailedException;
import io.trektribe.backend.notification.NotificationDraft;
import io.trektribe.backend.notification.NotificationService;
import io.trektribe.backend.notification.NotificationStoreException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Expands one event into an independent {@link NotificationService#create} per recipient, run
 * concurrently. Every per-recipient failure is captured in the result; the coordinator itself never
 * throws for a recipient's failure and never rolls back a recipient that succeeded.
 */
@Component
public class FanOutCoordinator {

  private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);

  private final NotificationService notificationService;
  private final Executor fanOutExecutor;

  public FanOutCoordinator(
      NotificationService notificationService,
      @Qualifier("fanOutExecutor") Executor fanOutExecutor) {
    this.notificationService = notificationService;
    this.fanOutExecutor = fanOutExecutor;
  }

  public FanOutResult fanOut(List<String> recipientIds, NotificationDraft draft) {
    return fanOut(recipientIds, draft, null);
  }

  /**
   * @param deadline optional bound on the whole fan-out, measured from the call; recipients still
   *     running when it passes are reported as {@link FanOutErrorKind#DEADLINE_EXCEEDED} and their
   *     create may still land. With a deadline, recipients the saturated pool refuses are reported
   *     failed instead of running on the calling thread.
   */
  public FanOutResult fanOut(
      List<String> recipientIds, NotificationDraft draft, Duration deadline) {
    long deadlineNanos = deadline == null ? Long.MAX_VALUE : System.nanoTime() + deadline.toNanos();
    var recipients = new LinkedHashSet<>(recipientIds);
    Map<String, CompletableFuture<?>> pending = new LinkedHashMap<>();
    List<FanOutFailure> rejected = new ArrayList<>();
    for (String recipientId : recipients) {
      try {
        pending.put(
            recipientId,
            CompletableFuture.supplyAsync(
                () -> notificationService.create(recipientId, draft), fanOutExecutor));
      } catch (RejectedExecutionException e) {
        if (deadline == null) {
          pending.put(recipientId, runOnCaller(recipientId, draft));
        } else {
          rejected.add(
              new FanOutFailure(
                  recipientId, FanOutErrorKind.UNEXPECTED, "Fan-out pool is saturated"));
        }
      }
    }

    List<String> succeeded = new ArrayList<>();
    List<FanOutFailure> failed = new ArrayList<>();
    for (var entry : pending.entrySet()) {
      String recipientId = entry.getKey();
      try {
        await(entry.getValue(), deadlineNanos);
        succeeded.add(recipientId);
      } catch (TimeoutException e) {
        failed.add(
            new FanOutFailure(
                recipientId,
                FanOutErrorKind.DEADLINE_EXCEEDED,
                "Deadline of " + deadline + " passed"));
      } catch (ExecutionException | CompletionException e) {
        failed.add(classify(recipientId, e.getCause() != null ? e.getCause() : e));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        failed.add(
            new FanOutFailure(
                recipientId, FanOutErrorKind.UNEXPECTED, "Interrupted while waiting"));
      }
    }

    failed.addAll(rejected);
    var result = new FanOutResult(succeeded, failed);
    if (failed.isEmpty()) {
      log.info("Fan-out of {} reached {} recipients", draft.kind().wireValue(), succeeded.size());
    } else {
      log.warn(
          "Fan-out of {}: {} succeeded, {} failed: {}",
          draft.kind().wireValue(),
          succeeded.size(),
          failed.size(),
          failed);
    }
    return result;
  }

  private CompletableFuture<?> runOnCaller(String recipientId, NotificationDraft draft) {
    try {
      return CompletableFuture.completedFuture(notificationService.create(recipientId, draft));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static void await(CompletableFuture<?> future, long deadlineNanos)
      throws InterruptedException, ExecutionException, TimeoutException {
    if (deadlineNanos == Long.MAX_VALUE) {
      future.get();
      return;
    }
    long remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0 && !future.isDone()) {
      throw new TimeoutException();
    }
    future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
  }

  private static FanOutFailure classify(String recipientId, Throwable cause) {
    FanOutErrorKind kind;
    if (cause instanceof ValidationFailedException) {
      kind = FanOutErrorKind.VALIDATION;
    } else if (cause instanceof NotificationStoreException) {
      kind = FanOutErrorKind.STORE;
    } else {
      kind = FanOutErrorKind.UNEXPECTED;
      log.warn("Unexpected fan-out failure for recipient {}", recipientId, cause);
    }
    return new FanOutFailure(recipientId, kind, String.valueOf(cause.getMessage()));
  }
}
