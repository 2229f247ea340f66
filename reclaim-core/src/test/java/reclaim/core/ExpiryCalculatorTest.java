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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiryCalculatorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Duration TTL = Duration.ofSeconds(60);

  @Test
  @DisplayName("A record finished longer ago than its TTL is expired")
  void expiredAfterTtl() {
    assertThat(ExpiryCalculator.isExpired(TTL, NOW.minusSeconds(61), NOW)).isTrue();
  }

  @Test
  @DisplayName("A record still within its TTL is not expired")
  void notExpiredWithinTtl() {
    assertThat(ExpiryCalculator.isExpired(TTL, NOW.minusSeconds(59), NOW)).isFalse();
  }

  @Test
  @DisplayName("Reaching the TTL exactly is not expiry")
  void exactBoundaryIsNotExpired() {
    assertThat(ExpiryCalculator.isExpired(TTL, NOW.minus(TTL), NOW)).isFalse();
    assertThat(ExpiryCalculator.isExpired(TTL, NOW.minus(TTL).minusNanos(1), NOW)).isTrue();
  }

  @Test
  void zeroTtlExpiresRightAfterFinishing() {
    assertThat(ExpiryCalculator.isExpired(Duration.ZERO, NOW, NOW)).isFalse();
    assertThat(ExpiryCalculator.isExpired(Duration.ZERO, NOW.minusMillis(1), NOW)).isTrue();
  }

  @Test
  @DisplayName("A finish time in the future (clock skew) is never expired")
  void finishedInTheFuture() {
    assertThat(ExpiryCalculator.isExpired(Duration.ZERO, NOW.plusSeconds(5), NOW)).isFalse();
  }

  @Test
  void cleanupTimeSaturatesAtInstantMax() {
    Instant finishedAt = Instant.parse("2024-05-01T12:00:00Z");

    assertThat(ExpiryCalculator.cleanupTime(TTL, finishedAt)).isEqualTo(finishedAt.plus(TTL));
    assertThat(ExpiryCalculator.cleanupTime(Duration.ofSeconds(Long.MAX_VALUE), finishedAt))
        .isEqualTo(Instant.MAX);
  }
}
