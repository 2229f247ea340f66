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

package reclaim.api.coordination;

import reclaim.api.OperationRecord;
import reclaim.api.ResourceKey;

import java.util.Objects;

/**
 * A change notification for a single operation record, as delivered by the store's watch.
 *
 * <p>The set of variants is closed: {@link Created}, {@link Updated} and {@link Deleted}. {@link
 * #type()} allows exhaustive {@code switch} dispatch over them.
 */
public sealed interface ResourceEvent
    permits ResourceEvent.Created, ResourceEvent.Updated, ResourceEvent.Deleted {

  enum Type {
    /** A record was created. {@link Created#object()} is the new record. */
    CREATED,
    /** A record was updated. {@link Updated#newObject()} is the state after the change. */
    UPDATED,
    /** A record was deleted. Only the key is guaranteed to be known. */
    DELETED
  }

  Type type();

  ResourceKey key();

  record Created(OperationRecord object) implements ResourceEvent {
    public Created {
      Objects.requireNonNull(object, "object");
    }

    @Override
    public Type type() {
      return Type.CREATED;
    }

    @Override
    public ResourceKey key() {
      return object.key();
    }
  }

  /**
   * @param oldObject state before the change, {@code null} when the store cannot provide it
   * @param newObject state after the change
   */
  record Updated(OperationRecord oldObject, OperationRecord newObject) implements ResourceEvent {
    public Updated {
      Objects.requireNonNull(newObject, "newObject");
    }

    @Override
    public Type type() {
      return Type.UPDATED;
    }

    @Override
    public ResourceKey key() {
      return newObject.key();
    }
  }

  /**
   * @param key identity of the deleted record
   * @param lastKnown last state before deletion, {@code null} when the store cannot provide it
   */
  record Deleted(ResourceKey key, OperationRecord lastKnown) implements ResourceEvent {
    public Deleted {
      Objects.requireNonNull(key, "key");
    }

    @Override
    public Type type() {
      return Type.DELETED;
    }
  }
}
