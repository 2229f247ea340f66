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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationRecordTest {

  private static final ResourceKey KEY = ResourceKey.of("kafka", "rebalance-1");

  @Test
  void finishedAtMarksRecordFinished() {
    Instant finishedAt = Instant.parse("2024-05-01T12:00:00Z");
    OperationRecord record =
        OperationRecord.builder(KEY).ttlSecondsAfterFinished(90L).finishedAt(finishedAt).build();

    assertThat(record.finished()).isTrue();
    assertThat(record.finishedAt()).contains(finishedAt);
    assertThat(record.ttlAfterFinished()).contains(Duration.ofSeconds(90));
    assertThat(record.deletionRequested()).isFalse();
  }

  @Test
  void absentFieldsAreEmpty() {
    OperationRecord record = OperationRecord.builder(KEY).build();

    assertThat(record.finished()).isFalse();
    assertThat(record.finishedAt()).isEmpty();
    assertThat(record.ttlAfterFinished()).isEmpty();
  }

  @Test
  void zeroTtlIsKept() {
    assertThat(OperationRecord.builder(KEY).ttlSecondsAfterFinished(0L).build().ttlAfterFinished())
        .contains(Duration.ZERO);
  }

  @Test
  void rejectsNegativeTtl() {
    assertThatThrownBy(() -> OperationRecord.builder(KEY).ttlSecondsAfterFinished(-1L).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
