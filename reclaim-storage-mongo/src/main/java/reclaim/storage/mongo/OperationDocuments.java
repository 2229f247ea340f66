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
import reclaim.api.OperationRecord;
import reclaim.api.ResourceKey;

import java.time.Instant;
import java.util.Date;

/**
 * Maps operation records to and from their document form.
 *
 * <pre>
 * {
 *   _id: "namespace/name",
 *   namespace: "namespace",
 *   name: "name",
 *   ttl_seconds_after_finished: 300,          // optional
 *   current_task_finished_at: ISODate(...),   // optional
 *   finished: true,
 *   deletion_timestamp: ISODate(...),         // optional
 *   version: 3
 * }
 * </pre>
 */
public final class OperationDocuments {

  public static final String ID = "_id";
  public static final String NAMESPACE = "namespace";
  public static final String NAME = "name";
  public static final String TTL_SECONDS_AFTER_FINISHED = "ttl_seconds_after_finished";
  public static final String CURRENT_TASK_FINISHED_AT = "current_task_finished_at";
  public static final String FINISHED = "finished";
  public static final String DELETION_TIMESTAMP = "deletion_timestamp";
  public static final String VERSION = "version";

  private OperationDocuments() {}

  public static OperationRecord toRecord(Document doc) {
    ResourceKey key =
        doc.containsKey(NAMESPACE) && doc.containsKey(NAME)
            ? ResourceKey.of(doc.getString(NAMESPACE), doc.getString(NAME))
            : ResourceKey.parse(doc.getString(ID));

    Number ttl = doc.get(TTL_SECONDS_AFTER_FINISHED, Number.class);
    Number version = doc.get(VERSION, Number.class);

    return new OperationRecord(
        key,
        ttl == null ? null : ttl.longValue(),
        toInstant(doc.getDate(CURRENT_TASK_FINISHED_AT)),
        doc.getBoolean(FINISHED, false),
        toInstant(doc.getDate(DELETION_TIMESTAMP)),
        version == null ? 0L : version.longValue());
  }

  public static Document toDocument(OperationRecord record) {
    Document doc =
        new Document(ID, record.key().toString())
            .append(NAMESPACE, record.key().namespace())
            .append(NAME, record.key().name())
            .append(FINISHED, record.finished())
            .append(VERSION, record.version());
    if (record.ttlSecondsAfterFinished() != null) {
      doc.append(TTL_SECONDS_AFTER_FINISHED, record.ttlSecondsAfterFinished());
    }
    if (record.currentTaskFinishedAt() != null) {
      doc.append(CURRENT_TASK_FINISHED_AT, Date.from(record.currentTaskFinishedAt()));
    }
    if (record.deletionTimestamp() != null) {
      doc.append(DELETION_TIMESTAMP, Date.from(record.deletionTimestamp()));
    }
    return doc;
  }

  private static Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }
}
