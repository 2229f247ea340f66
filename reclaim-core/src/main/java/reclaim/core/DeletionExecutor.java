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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.ResourceKey;
import reclaim.api.ResourceNotFoundException;
import reclaim.api.StoreException;
import reclaim.api.coordination.ResourceStore;

/**
 * Deletes operation records. A record that is already gone counts as deleted, so repeated
 * deliveries of the same key converge on the same outcome.
 */
public final class DeletionExecutor {

  private final Logger log = LoggerFactory.getLogger(DeletionExecutor.class);

  private final ResourceStore store;

  public DeletionExecutor(ResourceStore store) {
    this.store = store;
  }

  /**
   * Deletes the record stored under {@code key}.
   *
   * @param key identity of the record
   * @throws StoreException if the store failed for any reason other than the record being absent
   */
  public void delete(ResourceKey key) {
    try {
      store.delete(key);
    } catch (ResourceNotFoundException e) {
      if (log.isDebugEnabled()) {
        log.debug("Operation record {} already deleted", e.getKey());
      }
    }
  }
}
