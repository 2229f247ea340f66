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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.OperationRecord;
import reclaim.api.ReconcileResult;
import reclaim.api.ResourceKey;
import reclaim.api.coordination.ResourceEvent;
import reclaim.api.coordination.ResourceStore;
import reclaim.api.coordination.Subscription;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an {@link OperationTtlReconciler} against the change events of a {@link ResourceStore}.
 *
 * <p>The controller watches all operation records, passes every event through its {@link
 * EventFilter}, and queues the keys of admitted events. A key is queued at most once and never
 * reconciled by two workers at the same time; a key queued while it is being reconciled is
 * reconciled again once the current pass ends. Results are interpreted as follows:
 *
 * <ul>
 *   <li>{@link ReconcileResult.Done}: forget the key;
 *   <li>{@link ReconcileResult.RequeueAfter}: queue the key again after the delay;
 *   <li>{@link ReconcileResult.Failed}: queue the key again after an exponential backoff.
 * </ul>
 *
 * <p>Records that already exist when the controller starts are replayed as creations, so a record
 * that finished while no controller was running is still collected.
 */
@ThreadSafe
public class OperationTtlController implements AutoCloseable {

  public static final String NAME = "OperationTtl";

  private final Logger log = LoggerFactory.getLogger(OperationTtlController.class);

  private final boolean ownExecutor;
  private final ScheduledExecutorService executor;
  private final ResourceStore store;
  private final OperationTtlReconciler reconciler;
  private final EventFilter eventFilter;
  private final TtlControllerOptions options;

  private final Object queueMonitor = new Object();

  @GuardedBy("queueMonitor")
  private final Set<ResourceKey> queued = new HashSet<>();

  @GuardedBy("queueMonitor")
  private final Set<ResourceKey> processing = new HashSet<>();

  private final Map<ResourceKey, Integer> failures = new ConcurrentHashMap<>();

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile Subscription subscription;

  @MustBeClosed
  public OperationTtlController(ResourceStore store, Clock clock) {
    this(
        newWorkerPool(TtlControllerOptions.defaults().workerThreads()),
        true,
        store,
        clock,
        TtlControllerOptions.defaults(),
        new TtlEventFilter());
  }

  public OperationTtlController(
      ScheduledExecutorService executor,
      ResourceStore store,
      Clock clock,
      TtlControllerOptions options) {
    this(executor, false, store, clock, options, new TtlEventFilter());
  }

  /**
   * Creates a controller on a caller-owned pool whose events must also pass {@code
   * additionalFilter}.
   */
  public OperationTtlController(
      ScheduledExecutorService executor,
      ResourceStore store,
      Clock clock,
      TtlControllerOptions options,
      EventFilter additionalFilter) {
    this(executor, false, store, clock, options, new TtlEventFilter().and(additionalFilter));
  }

  private OperationTtlController(
      ScheduledExecutorService executor,
      boolean ownExecutor,
      ResourceStore store,
      Clock clock,
      TtlControllerOptions options,
      EventFilter eventFilter) {
    this.executor = executor;
    this.ownExecutor = ownExecutor;
    this.store = store;
    this.reconciler = new OperationTtlReconciler(store, clock);
    this.options = options;
    this.eventFilter = eventFilter;
  }

  private static ScheduledExecutorService newWorkerPool(int threads) {
    return Executors.newScheduledThreadPool(
        threads, new ThreadFactoryBuilder().setNameFormat("reclaim-ttl-worker-%d").build());
  }

  /**
   * Subscribes to the store and queues every record that is already eligible.
   *
   * @throws IllegalStateException if the controller was already started or has been closed
   * @throws reclaim.api.StoreException if the initial listing fails; the controller is left
   *     unstarted and {@code start()} may be called again
   */
  public void start() {
    if (closed.get()) throw new IllegalStateException(NAME + " controller is closed");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(NAME + " controller already started");
    }
    this.subscription = store.subscribe(this::onEvent);

    int primed = 0;
    try {
      for (OperationRecord record : store.list()) {
        if (onEvent(new ResourceEvent.Created(record))) primed++;
      }
    } catch (RuntimeException e) {
      // Leave the controller startable again.
      this.subscription.unsubscribe();
      this.subscription = null;
      started.set(false);
      log.warn("[{}] controller failed to list operation records on start-up", NAME, e);
      throw e;
    }
    log.info("[{}] controller started, {} operation record(s) queued on start-up", NAME, primed);
  }

  private boolean onEvent(ResourceEvent event) {
    if (!eventFilter.admit(event)) return false;
    enqueue(event.key());
    return true;
  }

  /** Queues a reconcile of {@code key} unless one is already queued. */
  public void enqueue(ResourceKey key) {
    if (closed.get()) return;
    synchronized (queueMonitor) {
      if (!queued.add(key)) return;
      // An in-flight pass submits the key again when it ends.
      if (processing.contains(key)) return;
    }
    submit(key);
  }

  private void submit(ResourceKey key) {
    try {
      executor.execute(() -> process(key));
    } catch (RejectedExecutionException e) {
      synchronized (queueMonitor) {
        queued.remove(key);
      }
      log.debug("[{}] worker pool rejected reconcile of {}", NAME, key);
    }
  }

  private void process(ResourceKey key) {
    synchronized (queueMonitor) {
      queued.remove(key);
      processing.add(key);
    }
    try {
      ReconcileResult result;
      try {
        result = reconciler.reconcile(key);
      } catch (RuntimeException e) {
        log.error("[{}] reconcile of {} threw unexpectedly", NAME, key, e);
        result = ReconcileResult.failed(e);
      }
      handle(key, result);
    } finally {
      boolean again;
      synchronized (queueMonitor) {
        processing.remove(key);
        again = queued.contains(key);
      }
      if (again) submit(key);
    }
  }

  private void handle(ResourceKey key, ReconcileResult result) {
    if (result instanceof ReconcileResult.RequeueAfter requeue) {
      failures.remove(key);
      schedule(key, requeue.delay());
    } else if (result instanceof ReconcileResult.Failed failed) {
      if (closed.get()) return;
      int attempts = failures.merge(key, 1, Integer::sum);
      Duration delay = backoff(attempts);
      log.warn(
          "[{}] reconcile of {} failed (attempt {}), retrying in {}",
          NAME,
          key,
          attempts,
          delay,
          failed.error());
      schedule(key, delay);
    } else {
      failures.remove(key);
    }
  }

  private void schedule(ResourceKey key, Duration delay) {
    try {
      executor.schedule(() -> enqueue(key), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("[{}] worker pool rejected delayed reconcile of {}", NAME, key);
    }
  }

  /**
   * Retry delay after {@code attempts} consecutive failures: {@code failureBaseDelay * 2^(attempts
   * - 1)}, capped at {@code failureMaxDelay}.
   */
  @VisibleForTesting
  Duration backoff(int attempts) {
    int exponent = Math.max(0, attempts - 1);
    if (exponent >= Long.SIZE - 2) return options.failureMaxDelay();
    try {
      Duration delay = options.failureBaseDelay().multipliedBy(1L << exponent);
      return delay.compareTo(options.failureMaxDelay()) > 0 ? options.failureMaxDelay() : delay;
    } catch (ArithmeticException overflow) {
      return options.failureMaxDelay();
    }
  }

  @VisibleForTesting
  int failureCount(ResourceKey key) {
    return failures.getOrDefault(key, 0);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    Subscription current = this.subscription;
    if (current != null) current.unsubscribe();
    if (ownExecutor) {
      executor.shutdownNow();
    }
    log.info("[{}] controller closed", NAME);
  }
}
