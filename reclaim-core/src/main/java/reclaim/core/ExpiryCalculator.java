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

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/** Decides whether a finished record has outlived its time-to-live. */
public final class ExpiryCalculator {

  private ExpiryCalculator() {}

  /**
   * Returns {@code true} once strictly more than {@code ttl} has passed since {@code finishedAt}.
   * Reaching the TTL exactly is not expiry.
   *
   * @param ttl time-to-live after the task finished
   * @param finishedAt completion time of the task
   * @param now the caller's notion of the current time, from the same clock as {@code finishedAt}
   * @return whether the record may be deleted
   */
  public static boolean isExpired(Duration ttl, Instant finishedAt, Instant now) {
    return Duration.between(finishedAt, now).compareTo(ttl) > 0;
  }

  /**
   * Returns {@code finishedAt + ttl}, or {@link Instant#MAX} when that lies beyond the supported
   * time-line.
   */
  public static Instant cleanupTime(Duration ttl, Instant finishedAt) {
    try {
      return finishedAt.plus(ttl);
    } catch (ArithmeticException | DateTimeException overflow) {
      return Instant.MAX;
    }
  }
}
