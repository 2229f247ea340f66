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

package reclaim.api;

import java.time.Duration;
import java.util.Objects;

/**
 * The outcome of a single reconcile pass, handed back to the scheduler that drives the
 * reconciler.
 *
 * <ul>
 *   <li>{@link Done}: no further action is needed for the key.
 *   <li>{@link RequeueAfter}: recheck the key after the given delay; this is not an error.
 *   <li>{@link Failed}: recheck the key according to the scheduler's backoff policy.
 * </ul>
 */
public sealed interface ReconcileResult
    permits ReconcileResult.Done, ReconcileResult.RequeueAfter, ReconcileResult.Failed {

  static ReconcileResult done() {
    return Done.INSTANCE;
  }

  static ReconcileResult requeueAfter(Duration delay) {
    return new RequeueAfter(delay);
  }

  static ReconcileResult failed(Throwable error) {
    return new Failed(error);
  }

  /** Terminal outcome. */
  final class Done implements ReconcileResult {
    private static final Done INSTANCE = new Done();

    private Done() {}

    @Override
    public String toString() {
      return "Done";
    }
  }

  /**
   * Requests a new reconcile after {@code delay}.
   *
   * @param delay strictly positive delay
   */
  record RequeueAfter(Duration delay) implements ReconcileResult {
    public RequeueAfter {
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative() || delay.isZero()) {
        throw new IllegalArgumentException("requeue delay must be positive: " + delay);
      }
    }
  }

  /**
   * The pass failed and the key should be retried with backoff.
   *
   * @param error the failure as reported by the store, never {@code null}
   */
  record Failed(Throwable error) implements ReconcileResult {
    public Failed {
      Objects.requireNonNull(error, "error");
    }
  }
}
