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

package reclaim.api.coordination.command;

import reclaim.api.ResourceKey;

import java.util.Optional;

public interface CommandHandlerContext {

  /**
   * Returns the identity of the record being processed.
   *
   * @return The key of the record, or an empty optional for commands spanning all records.
   */
  Optional<ResourceKey> getResourceKey();
}
