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

import java.time.Duration;
import java.time.Instant;

/** Computes when a record that has not expired yet should be looked at again. */
public final class RequeuePlanner {

  static final Duration MIN_DELAY = Duration.ofSeconds(1);
  // Largest whole-second delay that still fits a millisecond scheduler.
  static final Duration MAX_DELAY = Duration.ofSeconds(Long.MAX_VALUE / 1000);

  private RequeuePlanner() {}

  /**
   * Returns the whole-second delay until {@code finishedAt + ttl}, plus one second.
   *
   * <p>Fractional seconds of the remaining time are dropped and a full second is added, so the
   * follow-up reconcile always lands after the clean-up time and never on or before it. The result
   * is at least one second and at most {@link #MAX_DELAY}.
   *
   * @param ttl time-to-live after the task finished
   * @param finishedAt completion time of the task
   * @param now current time
   * @return delay until the next reconcile, never shorter than one second
   */
  public static Duration planRequeue(Duration ttl, Instant finishedAt, Instant now) {
    Duration remaining = Duration.between(now, ExpiryCalculator.cleanupTime(ttl, finishedAt));
    // getSeconds() floors, nanos are dropped
    Duration delay = Duration.ofSeconds(remaining.getSeconds() + 1);
    if (delay.compareTo(MAX_DELAY) > 0) return MAX_DELAY;
    return delay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : delay;
  }
}
