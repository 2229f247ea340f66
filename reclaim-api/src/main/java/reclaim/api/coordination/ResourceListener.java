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

/**
 * A functional callback interface for receiving change events of operation records.
 *
 * <p>Implementations are registered via {@link ResourceStore#subscribe(ResourceListener)}. Being a
 * functional interface, it can be implemented concisely using lambda expressions.
 */
@FunctionalInterface
public interface ResourceListener {

  /**
   * Called when a record is created, updated or deleted.
   *
   * @param event The {@link ResourceEvent} describing the change.
   */
  void onEvent(ResourceEvent event);
}
