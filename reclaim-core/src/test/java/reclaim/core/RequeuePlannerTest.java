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

class RequeuePlannerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Duration TTL = Duration.ofSeconds(60);

  @Test
  @DisplayName("One second left plans a two second requeue")
  void addsOneSecondMargin() {
    assertThat(RequeuePlanner.planRequeue(TTL, NOW.minusSeconds(59), NOW))
        .isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  @DisplayName("Fractional seconds are dropped before the margin is added")
  void dropsFraction() {
    Instant finishedAt = NOW.minusSeconds(58).minusMillis(300); // 1.7s left
    assertThat(RequeuePlanner.planRequeue(TTL, finishedAt, NOW)).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  @DisplayName("The requeue always lands after the clean-up time")
  void requeueLandsAfterCleanupTime() {
    for (int millisLeft = 1; millisLeft <= 5_000; millisLeft += 97) {
      Instant finishedAt = NOW.minus(TTL).plusMillis(millisLeft);
      Duration delay = RequeuePlanner.planRequeue(TTL, finishedAt, NOW);
      assertThat(NOW.plus(delay)).isAfter(finishedAt.plus(TTL));
      assertThat(ExpiryCalculator.isExpired(TTL, finishedAt, NOW.plus(delay))).isTrue();
    }
  }

  @Test
  @DisplayName("Exactly at the clean-up time the delay is still one second")
  void neverShorterThanOneSecond() {
    assertThat(RequeuePlanner.planRequeue(TTL, NOW.minus(TTL), NOW))
        .isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  @DisplayName("The delay shrinks as time moves towards the clean-up time")
  void delayDecreasesAsTimeAdvances() {
    Instant finishedAt = NOW;
    Duration previous = RequeuePlanner.planRequeue(TTL, finishedAt, NOW);
    for (int elapsed = 1; elapsed < 60; elapsed++) {
      Duration next = RequeuePlanner.planRequeue(TTL, finishedAt, NOW.plusSeconds(elapsed));
      assertThat(next).isLessThan(previous).isGreaterThanOrEqualTo(Duration.ofSeconds(1));
      previous = next;
    }
  }

  @Test
  @DisplayName("Clean-up times past the end of the time-line are capped")
  void capsHugeTtl() {
    Duration forever = Duration.ofSeconds(Long.MAX_VALUE);
    assertThat(RequeuePlanner.planRequeue(forever, NOW, NOW)).isEqualTo(RequeuePlanner.MAX_DELAY);
    assertThat(RequeuePlanner.MAX_DELAY.toMillis()).isPositive();

    Duration pastInstantMax = Duration.ofSeconds(40_000_000_000_000_000L);
    assertThat(RequeuePlanner.planRequeue(pastInstantMax, NOW.minusSeconds(10), NOW))
        .isEqualTo(RequeuePlanner.MAX_DELAY);
  }
}
