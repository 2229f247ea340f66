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
import reclaim.api.ResourceNotFoundException;
import reclaim.api.StoreException;

import java.util.List;
import java.util.Optional;

/**
 * {@code ResourceStore} is the capability through which the garbage collector reads operation
 * records, deletes expired ones, and observes their changes.
 *
 * <p>The store is an external, eventually consistent key-value store with optimistic concurrency.
 * Implementations translate their native errors into {@link StoreException}; a missing record is
 * reported as an empty {@link Optional} by {@link #get(ResourceKey)} and as a {@link
 * ResourceNotFoundException} by {@link #delete(ResourceKey)}.
 *
 * <p>This interface extends {@link AutoCloseable}, implying that implementations may hold resources
 * (change-stream cursors, watcher threads) that need to be explicitly released.
 */
public interface ResourceStore extends AutoCloseable {

  /**
   * Retrieves the current snapshot of an operation record.
   *
   * @param key The identity of the record.
   * @return An {@link Optional} containing the record if it exists, or an empty {@link Optional}
   *     if the record is not found.
   * @throws StoreException if the record could not be read.
   */
  Optional<OperationRecord> get(ResourceKey key);

  /**
   * Deletes an operation record.
   *
   * @param key The identity of the record.
   * @throws ResourceNotFoundException if no record exists under {@code key}.
   * @throws StoreException if the delete could not be performed.
   */
  void delete(ResourceKey key);

  /**
   * Lists every operation record currently held by the store. Used to prime a controller on
   * start-up, before change events start flowing.
   *
   * @return A snapshot of all records; never {@code null}.
   * @throws StoreException if the records could not be read.
   */
  List<OperationRecord> list();

  /**
   * Subscribes to change events of all operation records.
   *
   * @param listener The {@link ResourceListener} invoked for each create, update or delete.
   * @return A {@link Subscription} that can be used to stop receiving events.
   */
  Subscription subscribe(ResourceListener listener);

  @Override
  void close();
}
