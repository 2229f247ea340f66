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
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of an externally owned operation record, as read from a {@link
 * reclaim.api.coordination.ResourceStore}.
 *
 * <p>The garbage collector only reads these fields and, once the time-to-live has elapsed, deletes
 * the record. It never creates or mutates one.
 *
 * @param key identity of the record
 * @param ttlSecondsAfterFinished seconds to keep the record after its task finished; {@code null}
 *     means the record is never deleted automatically
 * @param currentTaskFinishedAt when the current task reached a terminal state; {@code null} while
 *     the task is still running
 * @param finished whether the task has reached a terminal state
 * @param deletionTimestamp set once a deletion of the record has been requested
 * @param version document version maintained by the store
 */
public record OperationRecord(
    ResourceKey key,
    Long ttlSecondsAfterFinished,
    Instant currentTaskFinishedAt,
    boolean finished,
    Instant deletionTimestamp,
    long version) {

  public OperationRecord {
    Objects.requireNonNull(key, "key");
    if (ttlSecondsAfterFinished != null && ttlSecondsAfterFinished < 0) {
      throw new IllegalArgumentException(
          "ttlSecondsAfterFinished must not be negative: " + ttlSecondsAfterFinished);
    }
  }

  public Optional<Duration> ttlAfterFinished() {
    return Optional.ofNullable(ttlSecondsAfterFinished).map(Duration::ofSeconds);
  }

  public Optional<Instant> finishedAt() {
    return Optional.ofNullable(currentTaskFinishedAt);
  }

  public boolean deletionRequested() {
    return deletionTimestamp != null;
  }

  public static Builder builder(ResourceKey key) {
    return new Builder(key);
  }

  /** Fluent builder, mostly used by store adapters and tests. */
  public static final class Builder {
    private final ResourceKey key;
    private Long ttlSecondsAfterFinished;
    private Instant currentTaskFinishedAt;
    private boolean finished;
    private Instant deletionTimestamp;
    private long version;

    private Builder(ResourceKey key) {
      this.key = key;
    }

    public Builder ttlSecondsAfterFinished(Long ttlSecondsAfterFinished) {
      this.ttlSecondsAfterFinished = ttlSecondsAfterFinished;
      return this;
    }

    /** Marks the record finished at {@code finishedAt}. */
    public Builder finishedAt(Instant finishedAt) {
      this.currentTaskFinishedAt = finishedAt;
      this.finished = finishedAt != null;
      return this;
    }

    public Builder finished(boolean finished) {
      this.finished = finished;
      return this;
    }

    public Builder deletionTimestamp(Instant deletionTimestamp) {
      this.deletionTimestamp = deletionTimestamp;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public OperationRecord build() {
      return new OperationRecord(
          key,
          ttlSecondsAfterFinished,
          currentTaskFinishedAt,
          finished,
          deletionTimestamp,
          version);
    }
  }
}
