/*
 * Copyright 2025 XueFeng Ma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reclaim.core;

import com.google.common.base.Throwables;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.OperationRecord;
import reclaim.api.ReconcileResult;
import reclaim.api.ResourceKey;
import reclaim.api.coordination.ResourceStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Garbage-collects finished operation records whose time-to-live has elapsed.
 *
 * <p>Each call to {@link #reconcile(ResourceKey)} is a single pass over freshly read state:
 *
 * <ol>
 *   <li>fetch the record, a missing record is {@link ReconcileResult.Done};
 *   <li>a record without a TTL or without a finish time is {@link ReconcileResult.Done};
 *   <li>an expired record is deleted, "already deleted" included, then {@link
 *       ReconcileResult.Done};
 *   <li>otherwise {@link ReconcileResult.RequeueAfter} the time left until expiry.
 * </ol>
 *
 * <p>Store failures come back as {@link ReconcileResult.Failed} and are retried by the scheduler,
 * never here. Nothing is remembered between passes, so the reconciler is safe under redelivery,
 * restarts and replicas working on different keys.
 */
@ThreadSafe
public final class OperationTtlReconciler {

  private final Logger log = LoggerFactory.getLogger(OperationTtlReconciler.class);

  private final ResourceStore store;
  private final DeletionExecutor deletionExecutor;
  private final Clock clock;

  public OperationTtlReconciler(ResourceStore store, Clock clock) {
    this.store = store;
    this.deletionExecutor = new DeletionExecutor(store);
    this.clock = clock;
  }

  @CheckReturnValue
  public ReconcileResult reconcile(ResourceKey key) {
    if (log.isDebugEnabled()) {
      log.debug("Reconciling operation record {}", key);
    }
    if (Thread.currentThread().isInterrupted()) {
      return cancelled(key, "fetch", null);
    }

    Optional<OperationRecord> fetched;
    try {
      fetched = store.get(key);
    } catch (RuntimeException e) {
      return failed(key, "fetch", e);
    }
    // Deleted after the request was queued.
    if (fetched.isEmpty()) {
      return ReconcileResult.done();
    }

    OperationRecord record = fetched.get();
    Optional<Duration> ttl = record.ttlAfterFinished();
    Optional<Instant> finishedAt = record.finishedAt();
    if (ttl.isEmpty() || finishedAt.isEmpty()) {
      return ReconcileResult.done();
    }

    Instant now = clock.instant();
    Instant cleanupTime = ExpiryCalculator.cleanupTime(ttl.get(), finishedAt.get());

    if (ExpiryCalculator.isExpired(ttl.get(), finishedAt.get(), now)) {
      if (log.isDebugEnabled()) {
        log.debug(
            "Cleaning up finished operation record {}. finished: {} clean-up time: {}",
            key,
            finishedAt.get(),
            cleanupTime);
      }
      try {
        deletionExecutor.delete(key);
      } catch (RuntimeException e) {
        return failed(key, "delete", e);
      }
      return ReconcileResult.done();
    }

    Duration delay = RequeuePlanner.planRequeue(ttl.get(), finishedAt.get(), now);
    if (log.isDebugEnabled()) {
      log.debug(
          "Requeue later to clean up operation record {}. clean-up time: {} delay: {}",
          key,
          cleanupTime,
          delay);
    }
    return ReconcileResult.requeueAfter(delay);
  }

  private ReconcileResult failed(ResourceKey key, String operation, RuntimeException error) {
    if (Thread.currentThread().isInterrupted()
        || Throwables.getCausalChain(error).stream()
            .anyMatch(t -> t instanceof InterruptedException)) {
      return cancelled(key, operation, error);
    }
    log.warn("Failed to {} operation record {}: {}", operation, key, error.getMessage());
    return ReconcileResult.failed(error);
  }

  private ReconcileResult cancelled(ResourceKey key, String operation, Throwable cause) {
    // Keep the interrupt visible to whoever owns the thread.
    Thread.currentThread().interrupt();
    CancellationException cancelled =
        new CancellationException("Reconcile of " + key + " cancelled during " + operation);
    if (cause != null) cancelled.initCause(cause);
    log.info("Reconcile of operation record {} cancelled during {}", key, operation);
    return ReconcileResult.failed(cancelled);
  }
}
