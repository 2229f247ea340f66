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

package reclaim.storage.mongo;

import org.bson.Document;
import org.junit.jupiter.api.Test;
import reclaim.api.OperationRecord;
import reclaim.api.ResourceKey;

import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationDocumentsTest {

  private static final ResourceKey KEY = ResourceKey.of("kafka", "rebalance-1");

  @Test
  void writesOptionalFieldsOnlyWhenSet() {
    Document doc = OperationDocuments.toDocument(OperationRecord.builder(KEY).version(2).build());

    assertThat(doc.getString(OperationDocuments.ID)).isEqualTo("kafka/rebalance-1");
    assertThat(doc.getBoolean(OperationDocuments.FINISHED)).isFalse();
    assertThat(doc.getLong(OperationDocuments.VERSION)).isEqualTo(2L);
    assertThat(doc)
        .doesNotContainKeys(
            OperationDocuments.TTL_SECONDS_AFTER_FINISHED,
            OperationDocuments.CURRENT_TASK_FINISHED_AT,
            OperationDocuments.DELETION_TIMESTAMP);
  }

  @Test
  void readsKeyFromIdWhenNameFieldsAreMissing() {
    Instant finishedAt = Instant.parse("2024-05-01T12:00:00Z");
    Document doc =
        new Document(OperationDocuments.ID, "kafka/rebalance-1")
            .append(OperationDocuments.TTL_SECONDS_AFTER_FINISHED, 45)
            .append(OperationDocuments.FINISHED, true)
            .append(OperationDocuments.CURRENT_TASK_FINISHED_AT, Date.from(finishedAt));

    OperationRecord record = OperationDocuments.toRecord(doc);

    assertThat(record.key()).isEqualTo(KEY);
    assertThat(record.ttlSecondsAfterFinished()).isEqualTo(45L);
    assertThat(record.currentTaskFinishedAt()).isEqualTo(finishedAt);
    assertThat(record.version()).isZero();
  }

  @Test
  void rejectsNegativeTtl() {
    Document doc =
        new Document(OperationDocuments.ID, "kafka/rebalance-1")
            .append(OperationDocuments.TTL_SECONDS_AFTER_FINISHED, -3L);

    assertThatThrownBy(() -> OperationDocuments.toRecord(doc))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
